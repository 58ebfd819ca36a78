package com.vidnyan.attackpath.domain.graph;

public enum Direction {
    INCOMING,
    OUTGOING
}
