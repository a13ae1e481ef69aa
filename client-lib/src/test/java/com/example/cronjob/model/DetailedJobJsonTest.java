package com.example.cronjob.model;

import com.example.cronjob.CronJobJson;
import com.example.cronjob.api.JobRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class DetailedJobJsonTest {

    private final ObjectMapper mapper = CronJobJson.newMapper();

    private static DetailedJob sampleJob() {
        return DetailedJob.builder()
                .job(Job.builder()
                        .jobId(42)
                        .enabled(true)
                        .title("Nightly export")
                        .saveResponses(false)
                        .url("https://example.com/export")
                        .lastStatus(JobStatus.FAILED_TIMEOUT)
                        .lastDuration(Milliseconds.of(30000))
                        .lastExecution(Seconds.of(1700000000L))
                        .nextExecution(Seconds.of(1700086400L))
                        .type(JobType.MONITORING)
                        .requestTimeout(Seconds.of(30))
                        .schedule(Schedule.builder()
                                .timezone("UTC")
                                .hours(List.of(2))
                                .monthDays(List.of(-1))
                                .minutes(List.of(15))
                                .months(List.of(-1))
                                .weekDays(List.of(1, 2, 3, 4, 5))
                                .build())
                        .requestMethod(RequestMethod.POST)
                        .build())
                .auth(JobAuth.builder().enable(true).user("svc").password("pw").build())
                .notification(JobNotificationSettings.builder().onFailure(true).onSuccess(false).onDisable(true).build())
                .extendedData(JobExtendedData.builder()
                        .headers(Map.of("X-Token", "abc"))
                        .body("{\"full\":true}")
                        .build())
                .build();
    }

    @Test
    public void jobFieldsAreFlattened() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(sampleJob()));

        assertThat(json.has("job"), is(false));
        assertThat(json.get("jobId").asInt(), is(42));
        assertThat(json.get("title").asText(), is("Nightly export"));
        assertThat(json.get("auth").get("user").asText(), is("svc"));
        assertThat(json.get("notification").get("onDisable").asBoolean(), is(true));
        assertThat(json.get("extendedData").get("headers").get("X-Token").asText(), is("abc"));
    }

    @Test
    public void enumsAndTimestampsAreWrittenAsIntegers() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(sampleJob()));

        assertThat(json.get("lastStatus").asInt(), is(5));
        assertThat(json.get("type").asInt(), is(1));
        assertThat(json.get("requestMethod").asInt(), is(1));
        assertThat(json.get("lastDuration").asLong(), is(30000L));
        assertThat(json.get("nextExecution").asLong(), is(1700086400L));
    }

    @Test
    public void roundTripsThroughJobEnvelope() throws Exception {
        DetailedJob original = sampleJob();

        String wire = mapper.writeValueAsString(new JobRequest(original));
        JobRequest decoded = mapper.readValue(wire, JobRequest.class);

        assertThat(decoded.getJob(), is(original));
    }

    @Test
    public void unsetFieldsAreOmitted() throws Exception {
        DetailedJob sparse = DetailedJob.builder().job(Job.builder().title("only title").build()).build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(sparse));

        assertThat(json.size(), is(1));
        assertThat(json.get("title").asText(), is("only title"));
    }

    @Test
    public void unknownPropertiesAreIgnored() throws Exception {
        DetailedJob job = mapper.readValue(
                "{\"jobId\": 1, \"folderId\": 7, \"auth\": {\"enable\": false, \"realm\": \"x\"}}", DetailedJob.class);

        assertThat(job.getJob().getJobId(), is(1));
        assertThat(job.getAuth().getEnable(), is(false));
    }

    @Test
    public void historyItemOmitsNullHeaders() throws Exception {
        HistoryItem item = HistoryItem.builder().jobId(1).body("ok").build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(item));

        assertThat(json.has("headers"), is(false));
        assertThat(json.get("body").asText(), is("ok"));
    }
}
