package io.jafar.hprof.internal;

import java.io.Closeable;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Random-access, read-only, big-endian view of an HPROF file.
 *
 * <p>Reads take an absolute position so that any number of {@link ByteCursor}s can share one
 * buffer without copying. Files larger than a single mapping are split into several mapped
 * regions (splices); reads that straddle two splices are stitched together.
 */
public interface HprofBuffer extends Closeable {

  /**
   * Memory-maps a file.
   *
   * @param path the file to map
   * @param spliceSize the maximum size of a single mapped region
   * @return a buffer over the whole file
   * @throws IOException if an I/O error occurs during mapping
   */
  static HprofBuffer map(Path path, int spliceSize) throws IOException {
    long size = Files.size(path);
    try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "r");
        FileChannel channel = raf.getChannel()) {
      if (size <= spliceSize) {
        return new ByteBufferWrapper(channel.map(FileChannel.MapMode.READ_ONLY, 0, size));
      }
      return new SplicedMappedBuffer(channel, size, spliceSize);
    }
  }

  /** Wraps an in-memory copy of a file. */
  static HprofBuffer wrap(byte[] data) {
    return new ByteBufferWrapper(ByteBuffer.wrap(data));
  }

  /** Returns the total size in bytes. */
  long size();

  byte get(long pos);

  short getShort(long pos);

  int getInt(long pos);

  long getLong(long pos);

  /** Copies {@code length} bytes starting at {@code pos} into {@code dest}. */
  void get(long pos, byte[] dest, int offset, int length);

  /** Drops the mappings; the buffer must not be used afterwards. */
  @Override
  void close();

  /** Single-region implementation, used for in-memory data and files up to the splice size. */
  final class ByteBufferWrapper implements HprofBuffer {
    private ByteBuffer delegate;

    ByteBufferWrapper(ByteBuffer delegate) {
      this.delegate = delegate.order(ByteOrder.BIG_ENDIAN);
    }

    @Override
    public long size() {
      return delegate.limit();
    }

    @Override
    public byte get(long pos) {
      return delegate.get((int) pos);
    }

    @Override
    public short getShort(long pos) {
      return delegate.getShort((int) pos);
    }

    @Override
    public int getInt(long pos) {
      return delegate.getInt((int) pos);
    }

    @Override
    public long getLong(long pos) {
      return delegate.getLong((int) pos);
    }

    @Override
    public void get(long pos, byte[] dest, int offset, int length) {
      delegate.get((int) pos, dest, offset, length);
    }

    @Override
    public void close() {
      delegate = null;
    }
  }

  /** Multi-region implementation for files larger than one mapping. */
  final class SplicedMappedBuffer implements HprofBuffer {
    private final int spliceSize;
    private final long size;
    private MappedByteBuffer[] splices;

    SplicedMappedBuffer(FileChannel channel, long size, int spliceSize) throws IOException {
      this.spliceSize = spliceSize;
      this.size = size;
      int count = (int) ((size + spliceSize - 1) / spliceSize);
      splices = new MappedByteBuffer[count];
      long remaining = size;
      for (int i = 0; i < count; i++) {
        splices[i] =
            channel.map(
                FileChannel.MapMode.READ_ONLY,
                (long) i * spliceSize,
                Math.min(spliceSize, remaining));
        splices[i].order(ByteOrder.BIG_ENDIAN);
        remaining -= spliceSize;
      }
    }

    @Override
    public long size() {
      return size;
    }

    @Override
    public byte get(long pos) {
      return splices[(int) (pos / spliceSize)].get((int) (pos % spliceSize));
    }

    @Override
    public short getShort(long pos) {
      int offset = (int) (pos % spliceSize);
      if (spliceSize - offset >= 2) {
        return splices[(int) (pos / spliceSize)].getShort(offset);
      }
      return (short) stitch(pos, 2);
    }

    @Override
    public int getInt(long pos) {
      int offset = (int) (pos % spliceSize);
      if (spliceSize - offset >= 4) {
        return splices[(int) (pos / spliceSize)].getInt(offset);
      }
      return (int) stitch(pos, 4);
    }

    @Override
    public long getLong(long pos) {
      int offset = (int) (pos % spliceSize);
      if (spliceSize - offset >= 8) {
        return splices[(int) (pos / spliceSize)].getLong(offset);
      }
      return stitch(pos, 8);
    }

    @Override
    public void get(long pos, byte[] dest, int offset, int length) {
      int loaded = 0;
      while (loaded < length) {
        long at = pos + loaded;
        int index = (int) (at / spliceSize);
        int spliceOffset = (int) (at % spliceSize);
        int toLoad = Math.min(spliceSize - spliceOffset, length - loaded);
        splices[index].get(spliceOffset, dest, offset + loaded, toLoad);
        loaded += toLoad;
      }
    }

    // Big-endian assembly of a value crossing a splice boundary.
    private long stitch(long pos, int width) {
      long value = 0;
      for (int i = 0; i < width; i++) {
        value = (value << 8) | (get(pos + i) & 0xFF);
      }
      return value;
    }

    @Override
    public void close() {
      splices = null;
    }
  }
}
