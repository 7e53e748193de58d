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
 * Data-access layer for partitioned billing exports.
 *
 * <p>Entry point is {@link org.finops.query.backend.BackendRegistry}: it builds a
 * {@link org.finops.query.backend.QueryBackend} for a
 * {@link org.finops.query.config.DatasetConfig}, and the backend resolves
 * partitions, picks the local mirror or the remote store, runs SQL and returns a
 * {@link org.finops.query.result.QueryResult}.
 *
 * <p>All failures are unchecked subclasses of {@link org.finops.query.QueryException}.
 */
package org.finops.query;
