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
package org.finops.query.sidetable;

/**
 * Supplies auxiliary tables (pricing, savings plans, reference data) that
 * the embedded backends register next to the billing relation so that
 * queries can join them.
 *
 * <p>A provider reports partial failure through
 * {@link SideTables#getWarnings()} instead of throwing.
 */
public interface SideTableProvider {

  SideTables get();
}
