package com.vidnyan.flowchart.domain.graph;

public enum NodeKind {
    ENTRY,
    EXIT,
    ACTION,
    DECISION,
    MERGE
}
