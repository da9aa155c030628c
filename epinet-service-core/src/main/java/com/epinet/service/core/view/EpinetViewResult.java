package com.epinet.service.core.view;

import com.epinet.service.core.load.LoadStatus;

public record EpinetViewResult(Status status, SankeyDiagram diagram, LoadStatus loadStatus) {

    public enum Status {
        READY,
        LOADING,
        NOT_FOUND
    }

    public static EpinetViewResult ready(SankeyDiagram diagram, LoadStatus loadStatus) {
        return new EpinetViewResult(Status.READY, diagram, loadStatus);
    }

    public static EpinetViewResult loading(LoadStatus loadStatus) {
        return new EpinetViewResult(Status.LOADING, null, loadStatus);
    }

    public static EpinetViewResult notFound(LoadStatus loadStatus) {
        return new EpinetViewResult(Status.NOT_FOUND, null, loadStatus);
    }
}
