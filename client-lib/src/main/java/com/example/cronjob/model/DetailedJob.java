package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A {@link Job} together with its auth, notification and extended request settings.
 * The job's own fields sit at the top level of the JSON object, next to
 * {@code auth}, {@code notification} and {@code extendedData}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetailedJob {

    @JsonUnwrapped
    @Builder.Default
    private Job job = new Job();

    private JobAuth auth;
    private JobNotificationSettings notification;
    private JobExtendedData extendedData;
}
