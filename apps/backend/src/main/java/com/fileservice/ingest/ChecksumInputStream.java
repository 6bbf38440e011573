package com.fileservice.ingest;

import com.fileservice.exception.PayloadTooLargeException;
import com.fileservice.exception.UploadInterruptedException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;

/**
 * 存储写入时顺带计算 SHA-256 与字节数：字节只经过一次，不做二次缓冲。
 * 超过 maxBytes 立即抛 {@link PayloadTooLargeException}；
 * 上游（客户端）读失败转成 {@link UploadInterruptedException}，不会被当成后端故障。
 *
 * <p>只有在存储写入成功返回后才应调用 {@link #hexDigest()}。
 */
public class ChecksumInputStream extends FilterInputStream {

    private final MessageDigest digest = DigestUtils.getSha256Digest();
    private final long maxBytes;
    private long count;
    private String hex;

    public ChecksumInputStream(InputStream in, long maxBytes) {
        super(in);
        this.maxBytes = maxBytes;
    }

    @Override
    public int read() throws IOException {
        int b;
        try {
            b = super.read();
        } catch (IOException e) {
            throw new UploadInterruptedException("Upload stream interrupted after " + count + " bytes", e);
        }
        if (b != -1) {
            count++;
            checkLimit();
            digest.update((byte) b);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n;
        try {
            n = super.read(b, off, len);
        } catch (IOException e) {
            throw new UploadInterruptedException("Upload stream interrupted after " + count + " bytes", e);
        }
        if (n > 0) {
            count += n;
            checkLimit();
            digest.update(b, off, n);
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        // 跳过的字节不会进摘要，直接禁止
        throw new IOException("skip is not supported while hashing");
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    @Override
    public synchronized void mark(int readlimit) {
        // 不支持
    }

    @Override
    public synchronized void reset() throws IOException {
        throw new IOException("mark/reset not supported");
    }

    public long getCount() {
        return count;
    }

    /** 结束摘要并返回小写 hex；多次调用返回同一个值 */
    public String hexDigest() {
        if (hex == null) {
            hex = Hex.encodeHexString(digest.digest());
        }
        return hex;
    }

    private void checkLimit() {
        if (maxBytes > 0 && count > maxBytes) {
            throw new PayloadTooLargeException(maxBytes, count);
        }
    }
}
