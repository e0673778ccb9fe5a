package com.sitemapper.core.crawler;

import com.sitemapper.core.model.LinkReport;

/** 리포트 수신측. 여러 워커 스레드에서 동시에 emit 될 수 있다. */
public interface ReportSink {
    void emit(LinkReport report);

    /** 런 종료 시 정확히 한 번 호출된다. */
    void complete();
}
