package com.example.cronjob.examples;

import com.example.cronjob.CronJobClient;
import com.example.cronjob.CronJobClientConfig;
import com.example.cronjob.exception.CronJobException;
import com.example.cronjob.model.DetailedJob;
import com.example.cronjob.model.Job;
import com.example.cronjob.model.RequestMethod;
import com.example.cronjob.model.Schedule;
import com.example.cronjob.model.Seconds;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates a disabled job that calls httpbin every minute.
 * Needs CRONJOB_API_KEY; CRONJOB_BASE_URL and CRONJOB_TIMEOUT_SECONDS are optional.
 */
@Slf4j
public class CreateJobExample {
    public static void main(String[] args) {
        String apiKey = System.getenv("CRONJOB_API_KEY");
        if (apiKey == null || apiKey.isBlank()) {
            log.error("CRONJOB_API_KEY is not set");
            System.exit(2);
        }

        CronJobClient client = new CronJobClient(apiKey, CronJobClientConfig.fromEnv());
        DetailedJob job = DetailedJob.builder()
                .job(Job.builder()
                        .url("https://httpbin.org/get?test=cronjob.org")
                        .title("Test Job")
                        .enabled(false)
                        .schedule(new Schedule())      // empty schedule is sent as every minute
                        .requestTimeout(Seconds.of(10))
                        .saveResponses(true)
                        .requestMethod(RequestMethod.GET)
                        .build())
                .build();
        try {
            int jobId = client.createJob(job);
            log.info("job created: {}", jobId);
        } catch (CronJobException e) {
            log.error("error creating job: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
