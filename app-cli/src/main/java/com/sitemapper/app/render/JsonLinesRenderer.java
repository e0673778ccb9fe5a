package com.sitemapper.app.render;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sitemapper.core.model.LinkReport;
import com.sitemapper.core.model.Status;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** 리포트 한 건당 JSON 한 줄 (NDJSON). 날짜는 ISO-8601. */
public final class JsonLinesRenderer implements ReportRenderer {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public void render(Iterable<LinkReport> reports, Writer out) throws IOException {
        for (LinkReport r : reports) {
            out.write(om.writeValueAsString(ReportView.of(r)));
            out.write('\n');
            out.flush();
        }
    }

    /** 출력 스키마 */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class ReportView {
        @JsonProperty("path") public String path;
        @JsonProperty("status") public StatusView status;
        @JsonProperty("points_to") public List<ReportView> pointsTo;

        static ReportView of(LinkReport r) {
            ReportView v = new ReportView();
            v.path = r.getPath().toString();
            v.status = StatusView.of(r.getStatus());
            v.pointsTo = new ArrayList<>();
            for (LinkReport kid : r.getChildren()) v.pointsTo.add(of(kid));
            return v;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class StatusView {
        @JsonProperty("is_live") public boolean live;
        @JsonProperty("is_crawlable") public boolean crawlable;
        @JsonProperty("last_status") public int lastStatus;
        @JsonProperty("at") public Instant at;
        @JsonProperty("reason") public String reason;

        static StatusView of(Status s) {
            StatusView v = new StatusView();
            v.live = s.isLive();
            v.crawlable = s.isCrawlable();
            v.lastStatus = s.getLastStatusCode();
            v.at = s.getObservedAt();
            v.reason = s.reason();
            return v;
        }
    }
}
