package com.seoanalyzer.core.store;

import java.util.UUID;
import java.util.regex.Pattern;

/** 8자리 hex 잡 ID */
final class JobIds {
    private JobIds() {}

    private static final Pattern FORMAT = Pattern.compile("[0-9a-f]{8}");

    static String next() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /** next() 가 만드는 형식인지. 파일 경로에 쓰기 전에 반드시 확인한다 */
    static boolean isValid(String id) {
        return id != null && FORMAT.matcher(id).matches();
    }
}
