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
package org.finops.query.storage;

import org.finops.query.config.DatasetLocation;

import com.amazonaws.services.s3.AmazonS3;

import java.util.function.Supplier;

/**
 * Chooses the storage provider for a dataset location.
 */
public final class StorageProviderFactory {

  private StorageProviderFactory() {
  }

  /**
   * Returns an S3 provider for {@code s3://} roots and a local file system
   * provider for anything else. The S3 client is obtained on the first read.
   */
  public static StorageProvider forLocation(DatasetLocation location,
      Supplier<AmazonS3> s3Client) {
    if (location.isRemote()) {
      return new S3StorageProvider(s3Client);
    }
    return new LocalFileStorageProvider();
  }
}
