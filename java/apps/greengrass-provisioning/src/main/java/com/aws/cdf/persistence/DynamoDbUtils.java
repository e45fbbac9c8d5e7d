/*
 *  Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License"). You may not use this file except in compliance
 *  with the License. A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  or in the 'license' file accompanying this file. This file is distributed on an 'AS IS' BASIS, WITHOUT WARRANTIES
 *  OR CONDITIONS OF ANY KIND, express or implied. See the License for the specific language governing permissions
 *  and limitations under the License.
 */

package com.aws.cdf.persistence;

import com.aws.cdf.exceptions.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.joda.time.DateTime;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Marshalling helpers shared by the DynamoDB backed daos. Absent values are never written as attributes.
 */
@Slf4j
public final class DynamoDbUtils {

    private DynamoDbUtils() {
    }

    public static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }

    public static void putString(Map<String, AttributeValue> item, String key, String value) {
        if (value != null) {
            item.put(key, s(value));
        }
    }

    public static void putNumber(Map<String, AttributeValue> item, String key, Number value) {
        if (value != null) {
            item.put(key, AttributeValue.builder().n(String.valueOf(value)).build());
        }
    }

    public static void putBoolean(Map<String, AttributeValue> item, String key, Boolean value) {
        if (value != null) {
            item.put(key, AttributeValue.builder().bool(value).build());
        }
    }

    public static void putDateTime(Map<String, AttributeValue> item, String key, DateTime value) {
        if (value != null) {
            item.put(key, s(value.toString()));
        }
    }

    public static void putStringMap(Map<String, AttributeValue> item, String key, Map<String, String> value) {
        if (value != null && !value.isEmpty()) {
            var m = new HashMap<String, AttributeValue>();
            value.forEach((k, v) -> putString(m, k, v));
            item.put(key, AttributeValue.builder().m(m).build());
        }
    }

    public static String getString(Map<String, AttributeValue> item, String key) {
        var value = item.get(key);
        return value != null ? value.s() : null;
    }

    public static Integer getInteger(Map<String, AttributeValue> item, String key) {
        var value = item.get(key);
        return (value != null && value.n() != null) ? Integer.valueOf(value.n()) : null;
    }

    public static Boolean getBoolean(Map<String, AttributeValue> item, String key) {
        var value = item.get(key);
        return value != null ? value.bool() : null;
    }

    public static DateTime getDateTime(Map<String, AttributeValue> item, String key) {
        var value = getString(item, key);
        return value != null ? DateTime.parse(value) : null;
    }

    public static Map<String, String> getStringMap(Map<String, AttributeValue> item, String key) {
        var value = item.get(key);
        if (value == null || !value.hasM()) {
            return null;
        }
        var result = new HashMap<String, String>();
        value.m().forEach((k, v) -> result.put(k, v.s()));
        return result;
    }

    /**
     * Waits on a DynamoDB call, translating any failure into an {@link UpstreamException}.
     */
    public static <T> T join(CompletableFuture<T> future, String operation) {
        try {
            return future.join();
        } catch (CompletionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            var statusCode = cause instanceof SdkServiceException ? ((SdkServiceException) cause).statusCode() : -1;
            log.error("join> " + operation + " failed", cause);
            throw new UpstreamException(String.format("DynamoDB %s failed: %s", operation, cause.getMessage()), statusCode, cause);
        }
    }
}
