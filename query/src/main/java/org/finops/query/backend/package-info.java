/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Query backends and the registry that creates them by name.
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link org.finops.query.backend.QueryBackend} - Common contract for every engine</li>
 *   <li>{@link org.finops.query.backend.BackendRegistry} - Name to factory mapping with case-insensitive lookup</li>
 *   <li>{@link org.finops.query.backend.AbstractEmbeddedBackend} - Partition discovery and source selection for in-process engines</li>
 * </ul>
 */
package org.finops.query.backend;
