package io.fullerstack.uptime.core.run;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fullerstack.uptime.core.model.ProbeResult;

/**
 * Serializes a {@link RunReport} for log ingestion.
 * <pre>{@code
 * {
 *   "statusCode": 200,
 *   "body": {
 *     "message": "URL ping completed",
 *     "success": true,
 *     "results": [
 *       {
 *         "url": "example.com",
 *         "status": {"is_up": true, "status_code": 200, "error": null},
 *         "flag_exists": false,
 *         "action": "NONE",
 *         "error": null
 *       }
 *     ]
 *   }
 * }
 * }</pre>
 */
public class RunReportJson {

    private final ObjectMapper objectMapper;

    public RunReportJson() {
        this(new ObjectMapper());
    }

    public RunReportJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toTree(RunReport report) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("statusCode", report.statusCode());

        ObjectNode body = envelope.putObject("body");
        body.put("message", report.message());
        body.put("success", report.success());

        ArrayNode results = body.putArray("results");
        for (EvaluationRecord record : report.records()) {
            ObjectNode result = results.addObject();
            result.put("url", record.url());
            writeStatus(result.putObject("status"), record.probeResult());
            if (record.flagExistedBefore() == null) {
                result.putNull("flag_exists");
            } else {
                result.put("flag_exists", record.flagExistedBefore());
            }
            result.put("action", record.action().name());
            if (record.error() == null) {
                result.putNull("error");
            } else {
                ObjectNode error = result.putObject("error");
                error.put("kind", record.error().kind().name());
                error.put("message", record.error().message());
            }
        }
        return envelope;
    }

    public String toJson(RunReport report) {
        try {
            return objectMapper.writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run report", e);
        }
    }

    private static void writeStatus(ObjectNode status, ProbeResult probe) {
        status.put("is_up", probe.reachable());
        if (probe.statusCode() == null) {
            status.putNull("status_code");
        } else {
            status.put("status_code", probe.statusCode());
        }
        status.put("error", probe.error());
    }
}
