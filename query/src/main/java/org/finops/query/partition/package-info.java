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
 * Discovery of date-keyed partition directories.
 *
 * <p>A dataset is laid out as
 * {@code <root>/<prefix>/<partitionKey>=<date>/<files>}, where the date is
 * {@code YYYY-MM} for monthly exports and {@code YYYY-MM-DD} for daily ones.
 * {@link org.finops.query.partition.PartitionCatalog} lists the directories
 * through a {@link org.finops.query.storage.StorageProvider}, keeps those whose
 * date falls in the configured range, and picks the data files in each.
 */
package org.finops.query.partition;
