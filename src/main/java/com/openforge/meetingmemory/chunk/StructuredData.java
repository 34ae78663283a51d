package com.openforge.meetingmemory.chunk;

/**
 * Tables, schemas or specifications captured verbatim from the meeting.
 *
 * @param type    table | schema | list | specification
 * @param content the formatted content
 * @param format  markdown | sql | json | yaml
 */
public record StructuredData(String type, String content, String format) {}
