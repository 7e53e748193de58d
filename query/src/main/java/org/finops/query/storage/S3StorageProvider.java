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

import com.amazonaws.AmazonServiceException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3ObjectSummary;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Storage provider implementation for Amazon S3 and S3-compatible stores.
 */
public class S3StorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3StorageProvider.class);

  private final Supplier<AmazonS3> s3Client;

  public S3StorageProvider(AmazonS3 s3Client) {
    this(() -> s3Client);
  }

  /**
   * Creates a provider whose client is obtained on first use, so that
   * credentials are only resolved when the store is actually read.
   */
  public S3StorageProvider(Supplier<AmazonS3> s3Client) {
    this.s3Client = s3Client;
  }

  /**
   * Builds an S3 client.
   *
   * @param credentials consulted on every request
   * @param region region of the bucket
   * @param endpoint custom endpoint for S3-compatible services, or null for AWS
   */
  public static AmazonS3 createClient(AWSCredentialsProvider credentials, String region,
      @Nullable String endpoint) {
    ClientConfiguration clientConfig = new ClientConfiguration();
    clientConfig.setSocketTimeout(15 * 60 * 1000);
    clientConfig.setConnectionTimeout(60 * 1000);

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(clientConfig)
        .withCredentials(credentials);

    if (endpoint != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region));
      // S3-compatible services like MinIO need path-style access
      builder.withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(region);
    }
    return builder.build();
  }

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    ListObjectsV2Request request = new ListObjectsV2Request()
        .withBucketName(s3Uri.bucket)
        .withPrefix(s3Uri.key)
        .withDelimiter(recursive ? null : "/");

    List<FileEntry> entries = new ArrayList<>();
    int pages = 0;
    try {
      ListObjectsV2Result page;
      do {
        page = s3Client.get().listObjectsV2(request);
        pages++;
        for (S3ObjectSummary summary : page.getObjectSummaries()) {
          // the prefix itself shows up as a zero-byte folder marker
          if (!summary.getKey().equals(s3Uri.key)) {
            entries.add(objectEntry(s3Uri.bucket, summary));
          }
        }
        if (!recursive) {
          for (String commonPrefix : page.getCommonPrefixes()) {
            entries.add(prefixEntry(s3Uri.bucket, commonPrefix));
          }
        }
        request.setContinuationToken(page.getNextContinuationToken());
      } while (page.isTruncated());
    } catch (SdkClientException e) {
      throw new IOException(e.getMessage(), e);
    }

    LOGGER.debug("Listed {} entries under {} in {} page(s), recursive={}", entries.size(), path,
        pages, recursive);
    return entries;
  }

  private static FileEntry objectEntry(String bucket, S3ObjectSummary summary) {
    String key = summary.getKey();
    long modified = summary.getLastModified() == null ? 0 : summary.getLastModified().getTime();
    return new FileEntry("s3://" + bucket + "/" + key, lastSegment(key), false,
        summary.getSize(), modified);
  }

  private static FileEntry prefixEntry(String bucket, String commonPrefix) {
    String trimmed = commonPrefix.endsWith("/")
        ? commonPrefix.substring(0, commonPrefix.length() - 1)
        : commonPrefix;
    return new FileEntry("s3://" + bucket + "/" + commonPrefix, lastSegment(trimmed), true, 0, 0);
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    try {
      ObjectMetadata metadata = s3Client.get().getObjectMetadata(s3Uri.bucket, s3Uri.key);
      return new FileMetadata(
          path,
          metadata.getContentLength(),
          metadata.getLastModified() == null ? 0 : metadata.getLastModified().getTime(),
          metadata.getETag());
    } catch (SdkClientException e) {
      throw new IOException("Failed to read metadata of " + path + ": " + e.getMessage(), e);
    }
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    try {
      return s3Client.get().getObject(s3Uri.bucket, s3Uri.key).getObjectContent();
    } catch (SdkClientException e) {
      throw new IOException("Failed to open " + path + ": " + e.getMessage(), e);
    }
  }

  @Override public boolean exists(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    try {
      boolean exists = s3Client.get().doesObjectExist(s3Uri.bucket, s3Uri.key);
      LOGGER.debug("S3 exists check: {} -> {}", path, exists);
      return exists;
    } catch (AmazonServiceException e) {
      LOGGER.warn("S3 exists check failed for {}: {} ({})", path, e.getMessage(),
          e.getErrorCode());
      return false;
    }
  }

  @Override public String getStorageType() {
    return "s3";
  }

  static S3Uri parseS3Uri(String uri) throws IOException {
    if (!uri.startsWith("s3://")) {
      throw new IOException("Invalid S3 URI: " + uri);
    }

    try {
      // S3 keys can contain spaces, but java.net.URI requires them to be encoded
      URI parsed = new URI(uri.replace(" ", "%20"));
      String bucket = parsed.getHost();
      if (bucket == null) {
        throw new IOException("Invalid S3 URI, no bucket: " + uri);
      }
      String key = parsed.getRawPath() == null ? "" : parsed.getRawPath();
      if (key.startsWith("/")) {
        key = key.substring(1);
      }
      key = URLDecoder.decode(key.replace("+", "%2B"), StandardCharsets.UTF_8.name());
      return new S3Uri(bucket, key);
    } catch (URISyntaxException e) {
      throw new IOException("Failed to parse S3 URI: " + uri, e);
    }
  }

  private static String lastSegment(String key) {
    int slash = key.lastIndexOf('/');
    return slash >= 0 && slash < key.length() - 1 ? key.substring(slash + 1) : key;
  }

  /** Bucket and key of an {@code s3://} URI. */
  static final class S3Uri {
    final String bucket;
    final String key;

    S3Uri(String bucket, String key) {
      this.bucket = bucket;
      this.key = key;
    }
  }
}
