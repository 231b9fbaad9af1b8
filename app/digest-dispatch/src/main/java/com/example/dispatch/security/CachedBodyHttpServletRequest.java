package com.example.dispatch.security;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * 署名検証のためにボディを先読みし、後続の読み取りにも同じバイト列を返すラッパ。
 *
 * <p>Content-Length を宣言しないリクエストもあるため、上限 + 1 バイトまでしか読まない。
 */
public class CachedBodyHttpServletRequest extends HttpServletRequestWrapper {

  private final byte[] body;

  public CachedBodyHttpServletRequest(HttpServletRequest request, long maxBodyBytes)
      throws IOException {
    super(request);
    final int readLimit = (int) Math.min(Integer.MAX_VALUE - 8L, maxBodyBytes + 1);
    final byte[] read = request.getInputStream().readNBytes(readLimit);
    if (read.length > maxBodyBytes) {
      throw new RequestBodyTooLargeException(maxBodyBytes);
    }
    this.body = read;
  }

  public String bodyAsString() {
    return new String(body, resolveCharset());
  }

  @Override
  public ServletInputStream getInputStream() {
    final ByteArrayInputStream source = new ByteArrayInputStream(body);
    return new ServletInputStream() {
      @Override
      public boolean isFinished() {
        return source.available() == 0;
      }

      @Override
      public boolean isReady() {
        return true;
      }

      @Override
      public void setReadListener(ReadListener readListener) {
        throw new UnsupportedOperationException("async read is not supported");
      }

      @Override
      public int read() {
        return source.read();
      }
    };
  }

  @Override
  public BufferedReader getReader() {
    return new BufferedReader(new InputStreamReader(getInputStream(), resolveCharset()));
  }

  private Charset resolveCharset() {
    final String encoding = getCharacterEncoding();
    if (encoding == null) {
      return StandardCharsets.UTF_8;
    }
    try {
      return Charset.forName(encoding);
    } catch (IllegalArgumentException ex) {
      return StandardCharsets.UTF_8;
    }
  }
}
