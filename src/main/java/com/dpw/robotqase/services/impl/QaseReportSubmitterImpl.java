package com.dpw.robotqase.services.impl;

import com.dpw.robotqase.dto.ResultCreate;
import com.dpw.robotqase.dto.ResultCreateBulkRequest;
import com.dpw.robotqase.dto.RunCreateRequest;
import com.dpw.robotqase.exception.QaseApiException;
import com.dpw.robotqase.model.NormalizedTestResult;
import com.dpw.robotqase.model.QaseRunOptions;
import com.dpw.robotqase.services.IReportSubmitter;
import com.dpw.robotqase.utils.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class QaseReportSubmitterImpl implements IReportSubmitter {

    static final String TOKEN_HEADER = "Token";

    private final RestTemplate qaseRestTemplate;

    @Override
    public long submit(QaseRunOptions options, List<NormalizedTestResult> results) {
        long runId = createRun(options, results);
        createResults(options, runId, results);
        completeRun(options, runId);
        return runId;
    }

    private long createRun(QaseRunOptions options, List<NormalizedTestResult> results) {
        log.info("Creating test run '{}' in project {}", options.getRunTitle(), options.getProject());

        Set<Long> caseIds = new LinkedHashSet<>();
        results.forEach(result -> caseIds.add(result.getExternalId()));

        RunCreateRequest request = new RunCreateRequest(options.getRunTitle(), new ArrayList<>(caseIds));
        String body = post("create test run", options, request, "/run/{project}", options.getProject());

        Number runId = JsonUtils.read(body, "$.result.id", Number.class)
                .orElseThrow(() -> new QaseApiException("create test run", 200, body, "response has no run id"));
        log.info("Created test run ID: {}", runId);
        return runId.longValue();
    }

    private void createResults(QaseRunOptions options, long runId, List<NormalizedTestResult> results) {
        log.info("Creating {} test run result(s) for run ID: {}", results.size(), runId);

        List<ResultCreate> qaseResults = results.stream()
                .map(this::toResultCreate)
                .toList();

        post("create test run results", options, new ResultCreateBulkRequest(qaseResults),
                "/result/{project}/{runId}/bulk", options.getProject(), runId);
    }

    private void completeRun(QaseRunOptions options, long runId) {
        log.info("Completing test run ID: {}", runId);
        post("complete test run", options, null, "/run/{project}/{runId}/complete", options.getProject(), runId);
        log.info("Completed test run ID: {}", runId);
    }

    ResultCreate toResultCreate(NormalizedTestResult result) {
        ResultCreate qaseResult = new ResultCreate();
        qaseResult.setCaseId(result.getExternalId());
        qaseResult.setStatus(result.getStatus().getQaseValue());
        qaseResult.setTimeMs(result.getDurationMs());
        if (result.hasPackageLabel()) {
            qaseResult.setComment(String.format("Package: %s", result.getPackageLabel()));
        }
        return qaseResult;
    }

    private String post(String operation, QaseRunOptions options, Object payload, String path, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(TOKEN_HEADER, options.getApiToken());

        String requestBody = payload != null ? JsonUtils.toJsonString(payload) : null;
        log.debug("POST {} {}", path, requestBody);

        ResponseEntity<String> response;
        try {
            response = qaseRestTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(requestBody, headers),
                    String.class, uriVariables);
        } catch (HttpStatusCodeException e) {
            throw new QaseApiException(operation, e.getStatusCode().value(), e.getResponseBodyAsString(),
                    "status code: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new QaseApiException(operation, null, null, e.getMessage(), e);
        }

        int statusCode = response.getStatusCode().value();
        String body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new QaseApiException(operation, statusCode, body, "status code: " + statusCode + " " + body);
        }
        if (!JsonUtils.read(body, "$.status", Boolean.class).orElse(false)) {
            throw new QaseApiException(operation, statusCode, body, "status false");
        }
        return body;
    }
}
