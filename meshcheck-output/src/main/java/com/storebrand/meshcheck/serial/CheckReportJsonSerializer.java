/*
 * Copyright 2022 Storebrand ASA
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.storebrand.meshcheck.serial;

import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.storebrand.meshcheck.CheckReportDto;

/**
 * Turns a {@link CheckReportDto} into a JSON string, and back again. Handles {@link Instant} as ISO-8601 and
 * {@link Optional} as a nullable field.
 */
public class CheckReportJsonSerializer {

    private final ObjectMapper _objectMapper;
    private final ObjectWriter _objectWriter;

    public CheckReportJsonSerializer() {
        ObjectMapper mapper = new ObjectMapper();

        // Drop nulls
        mapper.setSerializationInclusion(Include.NON_NULL);

        // Reports written by newer versions may carry fields we do not know about.
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        // Instants as "2026-10-17T13:19:42Z", not as epoch numbers.
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

        // Optional<String> for subsystem, hint and error
        mapper.registerModule(new Jdk8Module());

        _objectMapper = mapper;
        _objectWriter = _objectMapper.writerWithDefaultPrettyPrinter();
    }

    public String serialize(CheckReportDto dto) {
        try {
            return _objectWriter.writeValueAsString(dto);
        }
        catch (JsonProcessingException e) {
            throw new SerializationException("Couldn't serialize CheckReportDto.", e);
        }
    }

    public CheckReportDto deserialize(String serialized) {
        try {
            return _objectMapper.readValue(serialized, CheckReportDto.class);
        }
        catch (JsonProcessingException e) {
            throw new SerializationException("Couldn't deserialize CheckReportDto.", e);
        }
    }

    /**
     * Thrown by the methods in this serializer when Jackson fails.
     */
    public static final class SerializationException extends RuntimeException {
        SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
