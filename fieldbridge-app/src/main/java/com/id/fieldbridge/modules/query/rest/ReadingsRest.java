package com.id.fieldbridge.modules.query.rest;

import com.id.fieldbridge.config.AppConfig;
import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.query.logic.CsvEncoder;
import com.id.fieldbridge.modules.query.model.PointsQuery;
import com.id.fieldbridge.modules.query.service.ReadingsQueryService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("readings")
public class ReadingsRest {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType(CsvEncoder.CONTENT_TYPE);

    private final ReadingsQueryService queryService;
    private final AppConfig appConfig;

    public ReadingsRest(ReadingsQueryService queryService, AppConfig appConfig) {
        this.queryService = queryService;
        this.appConfig = appConfig;
    }

    @GetMapping
    public ResponseEntity<?> listReadings(@RequestParam(value = "limit", required = false) Integer limit,
                                          @RequestParam(value = "device", required = false) String device,
                                          @RequestParam(value = "start", required = false) String start,
                                          @RequestParam(value = "end", required = false) String end,
                                          @RequestParam(value = "format", required = false) String format,
                                          @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        boolean csv = wantsCsv(format, accept);
        var readings = queryService.findReadings(buildQuery(null, limit, device, start, end));
        if (csv) {
            return ResponseEntity.ok().contentType(TEXT_CSV).body(CsvEncoder.encodeReadings(readings));
        }
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(readings);
    }

    @GetMapping("{measurement}")
    public ResponseEntity<?> listPoints(@PathVariable("measurement") String measurement,
                                        @RequestParam(value = "limit", required = false) Integer limit,
                                        @RequestParam(value = "device", required = false) String device,
                                        @RequestParam(value = "start", required = false) String start,
                                        @RequestParam(value = "end", required = false) String end,
                                        @RequestParam(value = "format", required = false) String format,
                                        @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        var variant = SensorVariant.fromMeasurement(measurement)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown measurement: " + measurement));
        boolean csv = wantsCsv(format, accept);
        var points = queryService.findPoints(buildQuery(variant, limit, device, start, end));
        if (csv) {
            return ResponseEntity.ok().contentType(TEXT_CSV).body(CsvEncoder.encodePoints(points));
        }
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(points);
    }

    private PointsQuery buildQuery(SensorVariant variant, Integer limit, String device, String start, String end) {
        int effectiveLimit = limit == null ? appConfig.getQueryDefaultLimit() : limit;
        if (effectiveLimit < 1 || effectiveLimit > appConfig.getQueryMaxLimit()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Limit must be between 1 and %d".formatted(appConfig.getQueryMaxLimit()));
        }
        Long startTms = parseTime("start", start);
        Long endTms = parseTime("end", end);
        if (startTms != null && endTms != null && startTms > endTms) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "start must not be after end");
        }
        return PointsQuery.builder()
                .variant(variant)
                .deviceId(device == null || device.isBlank() ? null : device)
                .start(startTms)
                .end(endTms)
                .limit(effectiveLimit)
                .build();
    }

    private static boolean wantsCsv(String format, String accept) {
        if (format != null && !format.isBlank()) {
            return switch (format.toLowerCase()) {
                case "csv" -> true;
                case "json" -> false;
                default -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported format: " + format);
            };
        }
        return accept != null && accept.contains(CsvEncoder.CONTENT_TYPE);
    }

    /**
     * Accepts epoch millis or an ISO-8601 instant.
     */
    private static Long parseTime(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            try {
                return Instant.parse(value.trim()).toEpochMilli();
            } catch (DateTimeParseException ex) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid %s: %s".formatted(name, value), ex);
            }
        }
    }
}
