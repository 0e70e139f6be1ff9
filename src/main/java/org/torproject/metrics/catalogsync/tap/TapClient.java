/* Copyright 2019--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for a TAP service with UWS asynchronous jobs and cookie-based
 * sessions, like the Gaia archive at {@code https://gea.esac.esa.int/tap-server}.
 *
 * <p>Results are requested in the TAP JSON format. Requests are never
 * retried here; failures surface as {@link TransientNetworkException} for
 * I/O problems and timeouts, and as {@link RemoteServiceException} for
 * anything the server rejects.</p>
 */
public class TapClient implements CatalogService {

  private static final Logger logger = LoggerFactory.getLogger(
      TapClient.class);

  private static final String FORM_CONTENT_TYPE
      = "application/x-www-form-urlencoded; charset=UTF-8";

  private static final String CRLF = "\r\n";

  private final String baseUrl;

  private final int connectTimeoutMillis;

  private final int readTimeoutMillis;

  private final long pollMillis;

  private final long jobTimeoutMillis;

  private volatile String sessionCookie;

  /**
   * Creates a client for the TAP service below the given base URL.
   *
   * @param baseUrl Base URL, e.g. {@code https://gea.esac.esa.int/tap-server}.
   * @param connectTimeoutMillis Connect timeout of every request.
   * @param readTimeoutMillis Read timeout of every request.
   * @param pollMillis Pause between two job phase requests.
   * @param jobTimeoutMillis Maximum time to wait for a job to finish.
   */
  public TapClient(URL baseUrl, int connectTimeoutMillis,
      int readTimeoutMillis, long pollMillis, long jobTimeoutMillis) {
    String base = baseUrl.toString();
    this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1)
        : base;
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.readTimeoutMillis = readTimeoutMillis;
    this.pollMillis = pollMillis;
    this.jobTimeoutMillis = jobTimeoutMillis;
  }

  /** Whether a session cookie is currently held. */
  public boolean hasSession() {
    return null != this.sessionCookie;
  }

  @Override
  public void login(String user, String password)
      throws CatalogServiceException {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("username", user);
    form.put("password", password);
    try {
      HttpURLConnection huc = this.postForm(this.url("/login"), form);
      int response = huc.getResponseCode();
      if (response != 200) {
        throw new SessionException("Login of user " + user
            + " refused with response code " + response + ": "
            + readError(huc));
      }
      String cookie = extractCookies(huc);
      if (null == cookie) {
        throw new SessionException("Login response did not set a session "
            + "cookie.");
      }
      this.sessionCookie = cookie;
      logger.debug("Logged in to {} as {}.", this.baseUrl, user);
    } catch (IOException e) {
      throw new TransientNetworkException("Cannot log in to " + this.baseUrl
          + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void logout() throws CatalogServiceException {
    try {
      HttpURLConnection huc = this.postForm(this.url("/logout"),
          new LinkedHashMap<>());
      int response = huc.getResponseCode();
      if (response != 200 && response != 204) {
        throw new SessionException("Logout refused with response code "
            + response + ".");
      }
      logger.debug("Logged out from {}.", this.baseUrl);
    } catch (IOException e) {
      throw new TransientNetworkException("Cannot log out from "
          + this.baseUrl + ": " + e.getMessage(), e);
    } finally {
      this.sessionCookie = null;
    }
  }

  @Override
  public ResultTable query(String adql) throws CatalogServiceException {
    try {
      HttpURLConnection huc = this.postForm(this.url("/tap/sync"),
          queryParameters(adql));
      int response = huc.getResponseCode();
      if (response != 200) {
        throw new RemoteServiceException("Query rejected with response code "
            + response + ": " + readError(huc), response);
      }
      try (InputStream in = new BufferedInputStream(huc.getInputStream())) {
        return ResultTable.fromJson(in);
      }
    } catch (IOException e) {
      throw new TransientNetworkException("Query to " + this.baseUrl
          + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String submitJob(String adql, UploadTable upload)
      throws CatalogServiceException {
    Map<String, String> form = queryParameters(adql);
    form.put("PHASE", "RUN");
    form.put("UPLOAD", upload.getName() + ",param:" + upload.getName());
    String boundary = "----catalogsync" + Long.toHexString(System.nanoTime());
    try {
      HttpURLConnection huc = this.openConnection(this.url("/tap/async"));
      this.prepare(huc, "POST");
      huc.setInstanceFollowRedirects(false);
      huc.setDoOutput(true);
      huc.setRequestProperty("Content-Type",
          "multipart/form-data; boundary=" + boundary);
      try (OutputStream out = huc.getOutputStream()) {
        out.write(multipartBody(boundary, form, upload));
      }
      int response = huc.getResponseCode();
      String location = huc.getHeaderField("Location");
      if ((response != 303 && response != 302 && response != 201)
          || null == location) {
        throw new RemoteServiceException("Job submission rejected with "
            + "response code " + response + ": " + readError(huc), response);
      }
      String jobId = location.substring(location.lastIndexOf('/') + 1);
      logger.debug("Submitted job {} with upload table {} of {} rows.", jobId,
          upload.getName(), upload.getIds().size());
      return jobId;
    } catch (IOException e) {
      throw new TransientNetworkException("Job submission to " + this.baseUrl
          + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public ResultTable fetchJobResults(String jobId)
      throws CatalogServiceException {
    long deadline = System.currentTimeMillis() + this.jobTimeoutMillis;
    try {
      String phase = this.getText(this.jobUrl(jobId, "/phase")).trim();
      while (!"COMPLETED".equals(phase)) {
        if ("ERROR".equals(phase) || "ABORTED".equals(phase)) {
          throw new RemoteServiceException("Job " + jobId + " ended in phase "
              + phase + ": " + this.getText(this.jobUrl(jobId, "/error")));
        }
        if (System.currentTimeMillis() > deadline) {
          throw new TransientNetworkException("Job " + jobId
              + " did not finish within " + this.jobTimeoutMillis
              + " ms, last phase " + phase + ".", null);
        }
        this.sleep(this.pollMillis);
        phase = this.getText(this.jobUrl(jobId, "/phase")).trim();
      }
      HttpURLConnection huc = this.openConnection(
          this.jobUrl(jobId, "/results/result"));
      this.prepare(huc, "GET");
      int response = huc.getResponseCode();
      if (response != 200) {
        throw new RemoteServiceException("Results of job " + jobId
            + " unavailable, response code " + response + ": "
            + readError(huc), response);
      }
      try (InputStream in = new BufferedInputStream(huc.getInputStream())) {
        return ResultTable.fromJson(in);
      }
    } catch (IOException e) {
      throw new TransientNetworkException("Fetching results of job " + jobId
          + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientNetworkException("Interrupted while waiting for job "
          + jobId + ".", e);
    }
  }

  @Override
  public void deleteJob(String jobId) throws ArtifactCleanupException {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("ACTION", "DELETE");
    try {
      HttpURLConnection huc = this.postForm(this.jobUrl(jobId, ""), form);
      int response = huc.getResponseCode();
      if (response != 200 && response != 204 && response != 303) {
        throw new ArtifactCleanupException("Deleting job " + jobId
            + " refused with response code " + response + ".");
      }
      logger.debug("Job {} deleted.", jobId);
    } catch (IOException e) {
      throw new ArtifactCleanupException("Deleting job " + jobId
          + " failed: " + e.getMessage(), e);
    }
  }

  /** Opens a connection to the given URL; tests substitute their own. */
  protected HttpURLConnection openConnection(URL url) throws IOException {
    return (HttpURLConnection) url.openConnection();
  }

  /** Pauses between two job phase requests. */
  protected void sleep(long millis) throws InterruptedException {
    Thread.sleep(millis);
  }

  private static Map<String, String> queryParameters(String adql) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("REQUEST", "doQuery");
    form.put("LANG", "ADQL");
    form.put("FORMAT", "json");
    form.put("QUERY", adql);
    return form;
  }

  private void prepare(HttpURLConnection huc, String method)
      throws IOException {
    huc.setRequestMethod(method);
    huc.setConnectTimeout(this.connectTimeoutMillis);
    huc.setReadTimeout(this.readTimeoutMillis);
    String cookie = this.sessionCookie;
    if (null != cookie) {
      huc.setRequestProperty("Cookie", cookie);
    }
  }

  private HttpURLConnection postForm(URL url, Map<String, String> form)
      throws IOException {
    HttpURLConnection huc = this.openConnection(url);
    this.prepare(huc, "POST");
    huc.setInstanceFollowRedirects(false);
    huc.setDoOutput(true);
    huc.setRequestProperty("Content-Type", FORM_CONTENT_TYPE);
    StringBuilder body = new StringBuilder();
    for (Map.Entry<String, String> entry : form.entrySet()) {
      if (body.length() > 0) {
        body.append('&');
      }
      body.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
    }
    try (OutputStream out = huc.getOutputStream()) {
      out.write(body.toString().getBytes(StandardCharsets.UTF_8));
    }
    return huc;
  }

  private String getText(URL url) throws IOException, RemoteServiceException {
    HttpURLConnection huc = this.openConnection(url);
    this.prepare(huc, "GET");
    int response = huc.getResponseCode();
    if (response != 200) {
      throw new RemoteServiceException("Request to " + url
          + " failed with response code " + response + ": "
          + readError(huc), response);
    }
    try (InputStream in = huc.getInputStream()) {
      return readFully(in);
    }
  }

  static byte[] multipartBody(String boundary, Map<String, String> form,
      UploadTable upload) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : form.entrySet()) {
      sb.append("--").append(boundary).append(CRLF)
          .append("Content-Disposition: form-data; name=\"")
          .append(entry.getKey()).append('"').append(CRLF).append(CRLF)
          .append(entry.getValue()).append(CRLF);
    }
    sb.append("--").append(boundary).append(CRLF)
        .append("Content-Disposition: form-data; name=\"")
        .append(upload.getName()).append("\"; filename=\"")
        .append(upload.getName()).append(".xml\"").append(CRLF)
        .append("Content-Type: application/x-votable+xml").append(CRLF)
        .append(CRLF)
        .append(upload.toVoTable()).append(CRLF)
        .append("--").append(boundary).append("--").append(CRLF);
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static String extractCookies(HttpURLConnection huc) {
    Map<String, List<String>> headers = huc.getHeaderFields();
    if (null == headers) {
      return null;
    }
    List<String> cookies = new ArrayList<>();
    for (Map.Entry<String, List<String>> header : headers.entrySet()) {
      if (null == header.getKey()
          || !"Set-Cookie".equalsIgnoreCase(header.getKey())) {
        continue;
      }
      for (String value : header.getValue()) {
        int semicolon = value.indexOf(';');
        cookies.add(semicolon < 0 ? value.trim()
            : value.substring(0, semicolon).trim());
      }
    }
    return cookies.isEmpty() ? null : String.join("; ", cookies);
  }

  private static String readError(HttpURLConnection huc) {
    try (InputStream err = huc.getErrorStream()) {
      return null == err ? "(no details)" : readFully(err).trim();
    } catch (IOException e) {
      return "(unreadable error: " + e.getMessage() + ")";
    }
  }

  private static String readFully(InputStream stream) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (BufferedInputStream in = new BufferedInputStream(stream)) {
      int len;
      byte[] data = new byte[1024];
      while ((len = in.read(data, 0, 1024)) >= 0) {
        bytes.write(data, 0, len);
      }
    }
    return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
  }

  private URL url(String path) throws IOException {
    return new URL(this.baseUrl + path);
  }

  private URL jobUrl(String jobId, String suffix) throws IOException {
    return this.url("/tap/async/" + jobId + suffix);
  }
}
