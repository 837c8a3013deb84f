package com.mediaflow.mediaflow_backend.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediaflow.mediaflow_backend.model.job.ParseResult;

/** Normalizes one provider payload (webhook body or poll response) for a model. */
@FunctionalInterface
public interface ResponseParser {

    ParseResult parse(JsonNode payload);
}
