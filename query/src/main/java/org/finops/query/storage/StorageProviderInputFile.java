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

import com.google.common.io.ByteStreams;

import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Parquet {@link InputFile} over a {@link StorageProvider}, so that
 * parquet-avro reads the remote store and the local mirror alike.
 *
 * <p>Each stream buffers the whole object. Export files are written in
 * bounded chunks, and Parquet seeks to the footer first, which a plain
 * object stream cannot do.
 */
public class StorageProviderInputFile implements InputFile {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageProviderInputFile.class);

  private final StorageProvider storage;
  private final String path;
  private @Nullable Long length;

  public StorageProviderInputFile(StorageProvider storage, String path) {
    this.storage = storage;
    this.path = path;
  }

  @Override public long getLength() throws IOException {
    if (length == null) {
      length = storage.getMetadata(path).getSize();
    }
    return length;
  }

  @Override public SeekableInputStream newStream() throws IOException {
    byte[] content;
    try (InputStream in = storage.openInputStream(path)) {
      content = ByteStreams.toByteArray(in);
    }
    LOGGER.debug("Buffered {} bytes of {}", content.length, path);
    return new BufferedStream(new PositionedBytes(content));
  }

  @Override public String toString() {
    return path;
  }

  /** Byte array stream that exposes and moves its read position. */
  private static final class PositionedBytes extends ByteArrayInputStream {
    PositionedBytes(byte[] content) {
      super(content);
    }

    synchronized long position() {
      return pos;
    }

    synchronized void position(long newPos) throws EOFException {
      if (newPos < 0 || newPos > count) {
        throw new EOFException("Seek to " + newPos + " outside 0.." + count);
      }
      pos = (int) newPos;
    }
  }

  /** Parquet stream over a buffered object. */
  private static final class BufferedStream extends DelegatingSeekableInputStream {
    private final PositionedBytes bytes;

    BufferedStream(PositionedBytes bytes) {
      super(bytes);
      this.bytes = bytes;
    }

    @Override public long getPos() {
      return bytes.position();
    }

    @Override public void seek(long newPos) throws IOException {
      bytes.position(newPos);
    }
  }
}
