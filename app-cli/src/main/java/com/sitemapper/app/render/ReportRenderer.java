package com.sitemapper.app.render;

import com.sitemapper.core.model.LinkReport;

import java.io.IOException;
import java.io.Writer;

/** 리포트 스트림 → 출력 형식. 스트림이 닫힐 때까지 소비한다. */
public interface ReportRenderer {
    void render(Iterable<LinkReport> reports, Writer out) throws IOException;
}
