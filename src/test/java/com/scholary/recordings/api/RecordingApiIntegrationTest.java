package com.scholary.recordings.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Drives the upload protocol and playback through the HTTP API against the local backend, with the
 * real job queue and finalization pool.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RecordingApiIntegrationTest {

  private static final String AGENT = "agent-7";

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @Test
  void chunkedUpload_shouldAssembleOutOfOrderChunksAndStreamWithRanges() throws Exception {
    String callRecordId = logCall(AGENT);

    JsonNode init =
        postJson(AGENT, Map.of("mode", "init", "call_record_id", callRecordId, "expected_chunks", 3), 201);
    assertThat(init.get("status").asText()).isEqualTo("initialized");
    String sessionId = init.get("session_id").asText();

    appendJson(sessionId, 1, "B");
    appendJson(sessionId, 0, "A");
    JsonNode last = appendJson(sessionId, 2, "C");
    assertThat(last.get("chunks_received").asInt()).isEqualTo(3);
    assertThat(last.get("total_size").asLong()).isEqualTo(3);

    JsonNode accepted =
        postJson(AGENT, Map.of("mode", "finalize", "session_id", sessionId), 202);
    assertThat(accepted.get("call_record_id").asText()).isEqualTo(callRecordId);
    awaitJob(accepted.get("job_id").asText(), "COMPLETED");

    mockMvc
        .perform(get("/api/call-records/{id}", callRecordId).header(CallerIdentityResolver.AGENT_ID_HEADER, AGENT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.has_recording").value(true));

    MvcResult whole = startPlayback(callRecordId, null);
    mockMvc
        .perform(asyncDispatch(whole))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.ACCEPT_RANGES, "bytes"))
        .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "audio/aac"))
        .andExpect(content().string("ABC"));

    MvcResult partial = startPlayback(callRecordId, "bytes=0-1");
    mockMvc
        .perform(asyncDispatch(partial))
        .andExpect(status().isPartialContent())
        .andExpect(header().string(HttpHeaders.CONTENT_RANGE, "bytes 0-1/3"))
        .andExpect(content().string("AB"));

    mockMvc
        .perform(
            get("/api/recordings/{id}", callRecordId)
                .header(CallerIdentityResolver.AGENT_ID_HEADER, AGENT)
                .header(HttpHeaders.RANGE, "bytes=3-"))
        .andExpect(status().isRequestedRangeNotSatisfiable())
        .andExpect(header().string(HttpHeaders.CONTENT_RANGE, "bytes */3"));
  }

  @Test
  void finalize_shouldCancelIncompleteUpload() throws Exception {
    String callRecordId = logCall(AGENT);
    JsonNode init =
        postJson(AGENT, Map.of("mode", "init", "call_record_id", callRecordId, "expected_chunks", 2), 201);
    String sessionId = init.get("session_id").asText();
    appendJson(sessionId, 0, "A");

    JsonNode accepted = postJson(AGENT, Map.of("mode", "finalize", "session_id", sessionId), 202);
    JsonNode job = awaitJob(accepted.get("job_id").asText(), "CANCELLED");

    assertThat(job.get("cancel_reason").asText()).isEqualTo("incomplete_upload");
    mockMvc
        .perform(get("/api/recordings/{id}", callRecordId).header(CallerIdentityResolver.AGENT_ID_HEADER, AGENT))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
  }

  @Test
  void simpleUpload_shouldAttachInBackground() throws Exception {
    String callRecordId = logCall(AGENT);
    MockMultipartFile file =
        new MockMultipartFile(
            "file", "call.mp3", "audio/mpeg", "MP3DATA".getBytes(StandardCharsets.UTF_8));

    String body =
        mockMvc
            .perform(
                multipart("/api/recordings")
                    .file(file)
                    .param("mode", "simple")
                    .param("call_record_id", callRecordId)
                    .header(CallerIdentityResolver.AGENT_ID_HEADER, AGENT))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("accepted"))
            .andReturn()
            .getResponse()
            .getContentAsString();
    awaitJob(objectMapper.readTree(body).get("job_id").asText(), "COMPLETED");

    MvcResult playback = startPlayback(callRecordId, null);
    mockMvc
        .perform(asyncDispatch(playback))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "audio/mpeg"))
        .andExpect(content().string("MP3DATA"));
  }

  @Test
  void directUpload_shouldConfirmAndRedirectPlayback() throws Exception {
    String callRecordId = logCall(AGENT);

    String presignBody =
        mockMvc
            .perform(
                post("/api/recordings/presign")
                    .header(CallerIdentityResolver.AGENT_ID_HEADER, AGENT)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        objectMapper.writeValueAsString(
                            Map.of("call_record_id", callRecordId, "content_type", "audio/aac"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.time_limited").value(false))
            .andReturn()
            .getResponse()
            .getContentAsString();
    JsonNode presign = objectMapper.readTree(presignBody);
    String objectKey = presign.get("object_key").asText();
    String uploadPath = presign.get("upload_url").asText().substring("http://localhost".length());

    mockMvc
        .perform(put(uploadPath).content("DIRECT".getBytes(StandardCharsets.UTF_8)))
        .andExpect(status().isOk());

    String otherCallRecordId = logCall(AGENT);
    JsonNode foreign =
        postJson(
            AGENT,
            Map.of("mode", "s3_confirm", "call_record_id", otherCallRecordId, "object_key", objectKey),
            400);
    assertThat(foreign.at("/error/code").asText()).isEqualTo("VALIDATION_ERROR");

    Map<String, Object> confirm = Map.of("mode", "s3_confirm", "call_record_id", callRecordId, "object_key", objectKey);
    assertThat(postJson(AGENT, confirm, 200).get("status").asText()).isEqualTo("attached");
    // Retrying the confirm is harmless
    postJson(AGENT, confirm, 200);

    mockMvc
        .perform(get("/api/recordings/{id}", callRecordId).header(CallerIdentityResolver.AGENT_ID_HEADER, AGENT))
        .andExpect(status().isFound())
        .andExpect(header().string(HttpHeaders.LOCATION, presign.get("upload_url").asText()));

    MvcResult download =
        mockMvc
            .perform(get(uploadPath).header(HttpHeaders.RANGE, "bytes=-3"))
            .andExpect(request().asyncStarted())
            .andReturn();
    mockMvc
        .perform(asyncDispatch(download))
        .andExpect(status().isPartialContent())
        .andExpect(content().string("ECT"));
  }

  @Test
  void recordings_shouldOnlyBeAvailableToOwnerOrAdmin() throws Exception {
    String callRecordId = logCall(AGENT);

    mockMvc
        .perform(get("/api/recordings/{id}", callRecordId).header(CallerIdentityResolver.AGENT_ID_HEADER, "agent-8"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error.code").value("AUTHORIZATION_ERROR"));

    mockMvc
        .perform(get("/api/recordings/{id}", callRecordId))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(
            get("/api/recordings/{id}", callRecordId)
                .header(CallerIdentityResolver.AGENT_ID_HEADER, "supervisor")
                .header(CallerIdentityResolver.AGENT_ROLE_HEADER, "admin"))
        .andExpect(status().isNotFound());
  }

  @Test
  void upload_shouldRejectMalformedRequests() throws Exception {
    String callRecordId = logCall(AGENT);

    postJson(AGENT, Map.of("mode", "teleport", "call_record_id", callRecordId), 400);
    postJson(AGENT, Map.of("mode", "init", "call_record_id", callRecordId), 400);
    postJson(AGENT, Map.of("mode", "append", "session_id", "AAAAAAAAAAAAAAAAAAAAAA", "index", 0, "bytes", "QQ=="), 404);
    postJson(
        AGENT,
        Map.of("mode", "s3_confirm", "call_record_id", callRecordId, "object_key", "elsewhere/x.aac"),
        400);
  }

  private String logCall(String agentId) throws Exception {
    String body =
        mockMvc
            .perform(
                post("/api/leads/{leadId}/calls", "lead-42")
                    .header(CallerIdentityResolver.AGENT_ID_HEADER, agentId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"outcome\":\"connected\",\"duration_seconds\":95}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.has_recording").value(false))
            .andReturn()
            .getResponse()
            .getContentAsString();
    return objectMapper.readTree(body).get("id").asText();
  }

  private JsonNode appendJson(String sessionId, int index, String chunk) throws Exception {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("mode", "append");
    request.put("session_id", sessionId);
    request.put("index", index);
    request.put(
        "bytes", Base64.getEncoder().encodeToString(chunk.getBytes(StandardCharsets.UTF_8)));
    return postJson(AGENT, request, 202);
  }

  private JsonNode postJson(String agentId, Map<String, Object> request, int expectedStatus)
      throws Exception {
    String body =
        mockMvc
            .perform(
                post("/api/recordings")
                    .header(CallerIdentityResolver.AGENT_ID_HEADER, agentId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().is(expectedStatus))
            .andReturn()
            .getResponse()
            .getContentAsString();
    return objectMapper.readTree(body);
  }

  private MvcResult startPlayback(String callRecordId, String range) throws Exception {
    var builder =
        get("/api/recordings/{id}", callRecordId).header(CallerIdentityResolver.AGENT_ID_HEADER, AGENT);
    if (range != null) {
      builder.header(HttpHeaders.RANGE, range);
    }
    return mockMvc.perform(builder).andExpect(request().asyncStarted()).andReturn();
  }

  private JsonNode awaitJob(String jobId, String expectedStatus) throws Exception {
    JsonNode job = null;
    for (int i = 0; i < 200; i++) {
      String body =
          mockMvc
              .perform(
                  get("/api/ingestion-jobs/{id}", jobId)
                      .header(CallerIdentityResolver.AGENT_ID_HEADER, AGENT))
              .andExpect(status().isOk())
              .andReturn()
              .getResponse()
              .getContentAsString();
      job = objectMapper.readTree(body);
      if (expectedStatus.equals(job.get("status").asText())) {
        return job;
      }
      Thread.sleep(50);
    }
    throw new AssertionError("Job " + jobId + " did not reach " + expectedStatus + ": " + job);
  }
}
