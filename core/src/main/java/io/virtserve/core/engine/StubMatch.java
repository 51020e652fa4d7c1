package io.virtserve.core.engine;

import io.virtserve.core.model.Stub;

/**
 * The stub selected for a request.
 *
 * @param index position of the stub in its imposter's stub list
 * @param stub  the stub
 */
public record StubMatch(int index, Stub stub) {}
