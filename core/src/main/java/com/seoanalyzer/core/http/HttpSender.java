package com.seoanalyzer.core.http;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/** 테스트/모킹용 송신 훅 */
@FunctionalInterface
public interface HttpSender {
    HttpResponse<String> send(HttpRequest req) throws Exception;
}
