package com.sitemapper.app.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitemapper.core.model.FailureKind;
import com.sitemapper.core.model.LinkReport;
import com.sitemapper.core.model.Status;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.net.URI;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLinesRendererTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:15:30Z");

    @Test
    void one_line_per_report_with_children_and_iso_dates() throws Exception {
        Status ok = Status.builder().live(true).crawlable(true).lastStatusCode(200).observedAt(AT).build();
        Status dead = Status.builder().lastStatusCode(404).failure(FailureKind.PAGE_FAILED).observedAt(AT).build();

        LinkReport root = new LinkReport(URI.create("http://a.com/"), ok,
                List.of(LinkReport.leaf(URI.create("http://a.com/x"), dead)));
        LinkReport x = LinkReport.leaf(URI.create("http://a.com/x"), dead);

        StringWriter sw = new StringWriter();
        new JsonLinesRenderer().render(List.of(root, x), sw);

        String[] lines = sw.toString().split("\n");
        assertThat(lines).hasSize(2);

        JsonNode first = new ObjectMapper().readTree(lines[0]);
        assertThat(first.get("path").asText()).isEqualTo("http://a.com/");
        assertThat(first.at("/status/is_live").asBoolean()).isTrue();
        assertThat(first.at("/status/last_status").asInt()).isEqualTo(200);
        assertThat(first.at("/status/at").asText()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(first.at("/status").has("reason")).isFalse();   // 정상이면 생략
        assertThat(first.at("/points_to/0/path").asText()).isEqualTo("http://a.com/x");
        assertThat(first.at("/points_to/0/status/reason").asText()).isEqualTo("page failed");

        JsonNode second = new ObjectMapper().readTree(lines[1]);
        assertThat(second.get("points_to")).isEmpty();
    }

    @Test
    void empty_stream_renders_nothing() throws Exception {
        StringWriter sw = new StringWriter();
        new JsonLinesRenderer().render(List.of(), sw);
        assertThat(sw.toString()).isEmpty();
    }
}
