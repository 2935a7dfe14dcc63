package com.spring.fateweaver.engine.state;

import java.util.List;
import java.util.Map;

/**
 * @param state    병합 결과 (입력 상태와 별개의 새 문서)
 * @param warnings 형식 불일치·보호 정책 위반 시도 등 경고 목록
 */
public record MergeResult(Map<String, Object> state, List<String> warnings) {}
