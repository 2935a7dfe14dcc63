package com.spring.fateweaver.service.turn;

import java.util.List;

public record KnowledgeBundle(List<String> brain, List<String> voice) {

    public static KnowledgeBundle empty() {
        return new KnowledgeBundle(List.of(), List.of());
    }
}
