package com.spring.fateweaver.external.llm;

/**
 * 지수 백오프 재시도 정책 (500ms → 1000ms → 2000ms)
 */
public record RetryPolicy(int maxRetries, long initialBackoffMs) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, 500);

    /** 재시도 대상 HTTP 상태 코드 */
    private static final int[] RETRYABLE_STATUS_CODES = {408, 429, 500, 502, 503, 504};

    public long backoffFor(int attempt) {
        return initialBackoffMs * (1L << (attempt - 1));
    }

    /**
     * 모든 시도가 타임아웃까지 간 경우의 총 소요 시간
     * @param perAttemptMs 시도 1회의 최대 시간 (연결 + 읽기 타임아웃)
     */
    public long worstCaseMillis(long perAttemptMs) {
        long total = (maxRetries + 1L) * perAttemptMs;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            total += backoffFor(attempt);
        }
        return total;
    }

    public boolean isRetryable(int statusCode) {
        for (int code : RETRYABLE_STATUS_CODES) {
            if (code == statusCode) return true;
        }
        return false;
    }
}
