package com.costtracker.costs.requestlog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "request_logs", indexes = @Index(name = "request_logs_ts_idx", columnList = "ts"))
public class RequestLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ts", nullable = false)
    private Instant ts;

    @Column(name = "service", nullable = false, length = 64)
    private String service;

    @Column(name = "type", nullable = false, length = 32)
    private String type;

    @Column(name = "method", length = 16)
    private String method;

    @Column(name = "path", length = 512)
    private String path;

    @Column(name = "status_code")
    private Integer statusCode;

    @Column(name = "response_time_ms")
    private Long responseTimeMs;

    @Column(name = "message", length = 1024)
    private String message;

    @Column(name = "meta", columnDefinition = "text")
    private String meta;

    protected RequestLogEntity() {
    }

    public RequestLogEntity(Instant ts, String service, String type, String method, String path,
                            Integer statusCode, Long responseTimeMs, String message, String meta) {
        this.ts = ts;
        this.service = service;
        this.type = type;
        this.method = method;
        this.path = path;
        this.statusCode = statusCode;
        this.responseTimeMs = responseTimeMs;
        this.message = message;
        this.meta = meta;
    }

    public Long getId() { return id; }
    public Instant getTs() { return ts; }
    public String getService() { return service; }
    public String getType() { return type; }
    public String getMethod() { return method; }
    public String getPath() { return path; }
    public Integer getStatusCode() { return statusCode; }
    public Long getResponseTimeMs() { return responseTimeMs; }
    public String getMessage() { return message; }
    public String getMeta() { return meta; }
}
