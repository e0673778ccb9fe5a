package com.sitemapper.core.crawler;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupLinkExtractorTest {

    private static final URI BASE = URI.create("http://ardan.com/");

    private static final String SAMPLE_PAGE = """
            <!DOCTYPE html>
            <html>
            <head>
            <meta charset="UTF-8">
              <title>Ardan Studios</title>
              <link href="/assets/application-4b77637cc302ef4af6c358864df26f88.css" media="screen" rel="stylesheet" />
              <link rel="stylesheet" href="/bootstrap/css/bootstrap.css">
              <script src="https://www.youtube.com/player_api"></script>
            </head>
            <body>
              <script src="/assets/application-9709f2e1ad6d5ec24402f59507f6822b.js"></script>
              <script src="/assets/application-valum.js.js"></script>

              <a href="/services"></a>
              <a href="/contacts"></a>

              <a href="http://youtube.com/x8433j4i"></a>
              <a href="http://gracehound.com/index"></a>
              <img class="ardan-symbol" src="/assets/ardan-symbol-93ee488d16f9bc56ad65659c2d8f41dc.png" />
              <img src="/assets/member1-55a2b7ac0a868d49fdf50ce39f0ce1ac.png" />
              <img src="/assets/member2-66485427ca4bd140e0547efb1ce12ce0.png" />
              <img src="/assets/member4-cfa03a1a15aed816528b8ec1ee6c95c6.png" />
              <img src="/assets/member5-6ee6a979c39c81e2b652f268cccaf265.png" />
            </body>
            </html>
            """;

    private final JsoupLinkExtractor extractor = new JsoupLinkExtractor();

    private static InputStream html(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private static Set<String> strings(Set<URI> links) {
        return links.stream().map(URI::toString).collect(Collectors.toSet());
    }

    @Test
    void sample_page_yields_every_href_and_src() throws IOException {
        Set<URI> links = extractor.extract(html(SAMPLE_PAGE), BASE);

        assertThat(strings(links)).containsExactlyInAnyOrder(
                "http://ardan.com/assets/application-4b77637cc302ef4af6c358864df26f88.css",
                "http://ardan.com/bootstrap/css/bootstrap.css",
                "https://www.youtube.com/player_api",
                "http://ardan.com/assets/application-9709f2e1ad6d5ec24402f59507f6822b.js",
                "http://ardan.com/assets/application-valum.js.js",
                "http://ardan.com/services",
                "http://ardan.com/contacts",
                "http://youtube.com/x8433j4i",
                "http://gracehound.com/index",
                "http://ardan.com/assets/ardan-symbol-93ee488d16f9bc56ad65659c2d8f41dc.png",
                "http://ardan.com/assets/member1-55a2b7ac0a868d49fdf50ce39f0ce1ac.png",
                "http://ardan.com/assets/member2-66485427ca4bd140e0547efb1ce12ce0.png",
                "http://ardan.com/assets/member4-cfa03a1a15aed816528b8ec1ee6c95c6.png",
                "http://ardan.com/assets/member5-6ee6a979c39c81e2b652f268cccaf265.png");
    }

    @Test
    void extraction_is_idempotent() throws IOException {
        Set<URI> first = extractor.extract(html(SAMPLE_PAGE), BASE);
        Set<URI> second = extractor.extract(html(SAMPLE_PAGE), BASE);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void duplicates_collapse_and_order_follows_document() throws IOException {
        String page = "<a href='/b'></a><a href='/a'></a><a href='/b'></a><img src='/a'>";
        Set<URI> links = extractor.extract(html(page), BASE);

        List<String> ordered = links.stream().map(URI::toString).collect(Collectors.toList());
        assertThat(ordered).containsExactly("http://ardan.com/b", "http://ardan.com/a");
    }

    @Test
    void void_placeholder_is_skipped_everywhere() throws IOException {
        String page = """
                <a href="javascript:void(0)">x</a>
                <a href=" javascript:void(0); ">y</a>
                <img src="javascript:void(0)">
                <img srcset="javascript:void(0) 1x, /real.png 2x">
                <a href="/ok">ok</a>
                """;
        Set<URI> links = extractor.extract(html(page), BASE);

        assertThat(strings(links)).containsExactlyInAnyOrder("http://ardan.com/real.png", "http://ardan.com/ok");
    }

    @Test
    void srcset_candidates_drop_their_descriptors() throws IOException {
        String page = "<img srcset=\"/img/small.png 480w, /img/large.png 1080w,/img/x2.png 2x\">";
        Set<URI> links = extractor.extract(html(page), BASE);

        assertThat(strings(links)).containsExactlyInAnyOrder(
                "http://ardan.com/img/small.png",
                "http://ardan.com/img/large.png",
                "http://ardan.com/img/x2.png");
    }

    @Test
    void relative_values_resolve_against_page_path() throws IOException {
        URI base = URI.create("http://ardan.com/docs/intro");
        String page = "<a href='next'></a><a href='../up'></a><a href='  /trimmed  '></a>";
        Set<URI> links = extractor.extract(html(page), base);

        assertThat(strings(links)).containsExactlyInAnyOrder(
                "http://ardan.com/docs/next",
                "http://ardan.com/up",
                "http://ardan.com/trimmed");
    }

    @Test
    void base_without_path_is_treated_as_root() throws IOException {
        Set<URI> links = extractor.extract(html("<a href='services'></a>"), URI.create("http://ardan.com"));
        assertThat(strings(links)).containsExactly("http://ardan.com/services");
    }

    @Test
    void malformed_values_are_dropped_without_failing() throws IOException {
        String page = "<a href='http://exa mple.com/%%'></a><a href='/fine'></a><img srcset='/fine 1x, ,'>";
        Set<URI> links = extractor.extract(html(page), BASE);

        assertThat(strings(links)).containsExactly("http://ardan.com/fine");
    }

    @Test
    void empty_href_points_at_the_page_itself() throws IOException {
        URI page = URI.create("http://ardan.com/docs/intro");
        Set<URI> links = extractor.extract(html("<a href=''></a><a href='   '></a><a href='/fine'></a>"), page);

        List<String> ordered = links.stream().map(URI::toString).collect(Collectors.toList());
        assertThat(ordered).containsExactly("http://ardan.com/docs/intro", "http://ardan.com/fine");
    }

    @Test
    void query_and_fragment_only_links_keep_the_page_path() throws IOException {
        URI page = URI.create("http://example.com/blog/post");
        Set<URI> links = extractor.extract(html("<a href='?page=2'></a><a href='#frag'></a>"), page);

        assertThat(links).hasSize(2);
        assertThat(strings(links)).contains("http://example.com/blog/post?page=2");
        assertThat(links).allSatisfy(u -> {
            assertThat(u.getHost()).isEqualTo("example.com");
            assertThat(u.getPath()).isEqualTo("/blog/post");
        });
    }

    @Test
    void page_without_links_yields_empty_set() throws IOException {
        assertThat(extractor.extract(html("<p>nothing here</p>"), BASE)).isEmpty();
    }

    @Test
    void unreadable_body_raises_io_exception() {
        InputStream broken = new InputStream() {
            @Override public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };
        assertThatThrownBy(() -> extractor.extract(broken, BASE))
                .isInstanceOf(IOException.class);
    }
}
