/* Copyright 2019--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Test class for {@link TapClient}, using a client whose connections are
 * mocked {@link HttpURLConnection HttpURLConnections}.
 */
public class TapClientTest {

  private static final String BASE = "http://tap.example.org/tap-server";

  private static final String RESULT = "{\"metadata\":[{\"name\":\"source_id\"},"
      + "{\"name\":\"ra\"}],\"data\":[[1,56.7],[2,56.8]]}";

  /** Client handing out prepared connections per URL, in order. */
  private static class MockedTapClient extends TapClient {

    private final Map<String, Deque<HttpURLConnection>> connections
        = new HashMap<>();

    private int sleeps;

    MockedTapClient(long jobTimeoutMillis) throws IOException {
      super(new URL(BASE + "/"), 1000, 1000, 1L, jobTimeoutMillis);
    }

    void add(String path, HttpURLConnection connection) {
      this.connections.computeIfAbsent(BASE + path,
          k -> new ArrayDeque<>()).add(connection);
    }

    @Override
    protected HttpURLConnection openConnection(URL url) throws IOException {
      Deque<HttpURLConnection> queue = this.connections.get(url.toString());
      if (null == queue || queue.isEmpty()) {
        throw new IOException("Unexpected request to " + url);
      }
      return queue.size() > 1 ? queue.poll() : queue.peek();
    }

    @Override
    protected void sleep(long millis) throws InterruptedException {
      this.sleeps++;
      Thread.sleep(2L);
    }
  }

  private MockedTapClient client;

  @Before
  public void setUp() throws Exception {
    this.client = new MockedTapClient(60_000L);
  }

  private static HttpURLConnection connection(int code, final String body,
      ByteArrayOutputStream requestBody) throws IOException {
    HttpURLConnection huc = mock(HttpURLConnection.class);
    given(huc.getResponseCode()).willReturn(code);
    willAnswer(invocation -> new ByteArrayInputStream(
        body.getBytes(StandardCharsets.UTF_8))).given(huc).getInputStream();
    if (code >= 400) {
      willAnswer(invocation -> new ByteArrayInputStream(
          body.getBytes(StandardCharsets.UTF_8))).given(huc).getErrorStream();
    }
    if (null != requestBody) {
      given(huc.getOutputStream()).willReturn(requestBody);
    }
    return huc;
  }

  private static String decoded(ByteArrayOutputStream body) throws Exception {
    return URLDecoder.decode(new String(body.toByteArray(),
        StandardCharsets.UTF_8), "UTF-8");
  }

  @Test
  public void testQuery() throws Exception {
    ByteArrayOutputStream sent = new ByteArrayOutputStream();
    HttpURLConnection huc = connection(200, RESULT, sent);
    this.client.add("/tap/sync", huc);
    ResultTable table = this.client.query("SELECT TOP 2 A.source_id FROM t A");
    assertEquals(Arrays.asList("source_id", "ra"), table.getColumns());
    assertEquals(2, table.size());
    assertEquals(1L, table.getRows().get(0)[0]);
    assertEquals(56.8, table.getRows().get(1)[1]);
    String form = decoded(sent);
    assertThat(form, containsString("FORMAT=json"));
    assertThat(form, containsString("LANG=ADQL"));
    assertThat(form, containsString("QUERY=SELECT TOP 2 A.source_id FROM t A"));
    verify(huc).setRequestMethod("POST");
    verify(huc, never()).setRequestProperty("Cookie", "JSESSIONID=abc");
  }

  @Test
  public void testQueryRejected() throws Exception {
    this.client.add("/tap/sync", connection(400, "Syntax error near FROM",
        new ByteArrayOutputStream()));
    try {
      this.client.query("SELECT");
      fail("Rejected query was not reported.");
    } catch (RemoteServiceException e) {
      assertEquals(400, e.getResponseCode());
      assertThat(e.getMessage(), containsString("Syntax error near FROM"));
      assertFalse(e.isTransient());
    }
  }

  @Test
  public void testQueryTimeout() throws Exception {
    HttpURLConnection huc = connection(200, RESULT,
        new ByteArrayOutputStream());
    given(huc.getResponseCode()).willThrow(new SocketTimeoutException(
        "Read timed out"));
    this.client.add("/tap/sync", huc);
    try {
      this.client.query("SELECT");
      fail("Timeout was not reported.");
    } catch (TransientNetworkException e) {
      assertTrue(e.isTransient());
      assertThat(e.getMessage(), containsString("Read timed out"));
    }
  }

  @Test
  public void testSessionCookie() throws Exception {
    ByteArrayOutputStream sent = new ByteArrayOutputStream();
    HttpURLConnection login = connection(200, "OK", sent);
    Map<String, List<String>> headers = new HashMap<>();
    headers.put("Set-Cookie", Collections.singletonList(
        "JSESSIONID=abc; Path=/tap-server; HttpOnly"));
    given(login.getHeaderFields()).willReturn(headers);
    this.client.add("/login", login);
    this.client.login("alice", "p&ss");
    assertTrue(this.client.hasSession());
    assertEquals("username=alice&password=p&ss", decoded(sent));

    HttpURLConnection query = connection(200, RESULT,
        new ByteArrayOutputStream());
    this.client.add("/tap/sync", query);
    this.client.query("SELECT");
    verify(query).setRequestProperty("Cookie", "JSESSIONID=abc");

    HttpURLConnection logout = connection(200, "", new ByteArrayOutputStream());
    this.client.add("/logout", logout);
    this.client.logout();
    verify(logout).setRequestProperty("Cookie", "JSESSIONID=abc");
    assertFalse(this.client.hasSession());
  }

  @Test
  public void testLoginRefused() throws Exception {
    this.client.add("/login", connection(401, "Bad credentials",
        new ByteArrayOutputStream()));
    try {
      this.client.login("alice", "wrong");
      fail("Refused login was not reported.");
    } catch (SessionException e) {
      assertThat(e.getMessage(), containsString("401"));
    }
    assertFalse(this.client.hasSession());
  }

  @Test(expected = SessionException.class)
  public void testLoginWithoutCookie() throws Exception {
    this.client.add("/login", connection(200, "OK",
        new ByteArrayOutputStream()));
    this.client.login("alice", "secret");
  }

  @Test
  public void testSubmitJob() throws Exception {
    ByteArrayOutputStream sent = new ByteArrayOutputStream();
    HttpURLConnection huc = connection(303, "", sent);
    given(huc.getHeaderField("Location")).willReturn(
        BASE + "/tap/async/1591962405263O");
    this.client.add("/tap/async", huc);
    UploadTable upload = new UploadTable("catalogsync_x", "source_id",
        new TreeSet<>(Arrays.asList(5L, 6L)));
    assertEquals("1591962405263O", this.client.submitJob("SELECT 1", upload));
    String body = new String(sent.toByteArray(), StandardCharsets.UTF_8);
    assertThat(body, containsString("name=\"PHASE\"\r\n\r\nRUN\r\n"));
    assertThat(body, containsString(
        "name=\"UPLOAD\"\r\n\r\ncatalogsync_x,param:catalogsync_x\r\n"));
    assertThat(body, containsString("filename=\"catalogsync_x.xml\""));
    assertThat(body, containsString("<TR><TD>6</TD></TR>"));
    verify(huc).setInstanceFollowRedirects(false);
  }

  @Test
  public void testSubmitJobRejected() throws Exception {
    this.client.add("/tap/async", connection(500, "Upload too large",
        new ByteArrayOutputStream()));
    try {
      this.client.submitJob("SELECT 1", new UploadTable("t", "source_id",
          new TreeSet<Long>()));
      fail("Rejected job was not reported.");
    } catch (RemoteServiceException e) {
      assertEquals(500, e.getResponseCode());
    }
  }

  @Test
  public void testFetchJobResults() throws Exception {
    this.client.add("/tap/async/42/phase", connection(200, "EXECUTING\n",
        null));
    this.client.add("/tap/async/42/phase", connection(200, "COMPLETED",
        null));
    this.client.add("/tap/async/42/results/result", connection(200, RESULT,
        null));
    ResultTable table = this.client.fetchJobResults("42");
    assertEquals(2, table.size());
    assertEquals(1, this.client.sleeps);
  }

  @Test
  public void testFetchFailedJob() throws Exception {
    this.client.add("/tap/async/42/phase", connection(200, "ERROR", null));
    this.client.add("/tap/async/42/error", connection(200,
        "Query timed out on server", null));
    try {
      this.client.fetchJobResults("42");
      fail("Failed job was not reported.");
    } catch (RemoteServiceException e) {
      assertThat(e.getMessage(), containsString("Query timed out on server"));
    }
  }

  @Test
  public void testFetchResultsUnavailable() throws Exception {
    this.client.add("/tap/async/42/phase", connection(200, "COMPLETED",
        null));
    this.client.add("/tap/async/42/results/result", connection(404,
        "Result of job 42 has expired", null));
    try {
      this.client.fetchJobResults("42");
      fail("Missing results were not reported.");
    } catch (RemoteServiceException e) {
      assertEquals(404, e.getResponseCode());
      assertThat(e.getMessage(), containsString("has expired"));
    }
  }

  @Test
  public void testPhaseRequestRefused() throws Exception {
    this.client.add("/tap/async/42/phase", connection(500,
        "Job store unavailable", null));
    try {
      this.client.fetchJobResults("42");
      fail("Refused phase request was not reported.");
    } catch (RemoteServiceException e) {
      assertEquals(500, e.getResponseCode());
      assertThat(e.getMessage(), containsString("Job store unavailable"));
    }
  }

  @Test
  public void testFetchJobTimeout() throws Exception {
    this.client = new MockedTapClient(0L);
    this.client.add("/tap/async/42/phase", connection(200, "QUEUED", null));
    try {
      this.client.fetchJobResults("42");
      fail("Job timeout was not reported.");
    } catch (TransientNetworkException e) {
      assertThat(e.getMessage(), containsString("QUEUED"));
    }
  }

  @Test
  public void testDeleteJob() throws Exception {
    ByteArrayOutputStream sent = new ByteArrayOutputStream();
    this.client.add("/tap/async/42", connection(303, "", sent));
    this.client.deleteJob("42");
    assertEquals("ACTION=DELETE", decoded(sent));
  }

  @Test(expected = ArtifactCleanupException.class)
  public void testDeleteJobRefused() throws Exception {
    this.client.add("/tap/async/42", connection(404, "No such job",
        new ByteArrayOutputStream()));
    this.client.deleteJob("42");
  }

  @Test(expected = ArtifactCleanupException.class)
  public void testDeleteJobNetworkFailure() throws Exception {
    HttpURLConnection huc = mock(HttpURLConnection.class);
    given(huc.getOutputStream()).willThrow(new IOException("reset"));
    this.client.add("/tap/async/42", huc);
    this.client.deleteJob("42");
  }
}
