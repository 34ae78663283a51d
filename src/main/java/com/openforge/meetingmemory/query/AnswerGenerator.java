package com.openforge.meetingmemory.query;

/**
 * Answer-generation collaborator (typically an LLM). Receives the ranked
 * chunks and returns the answer text.
 */
public interface AnswerGenerator {

    String generate(AnswerRequest request);
}
