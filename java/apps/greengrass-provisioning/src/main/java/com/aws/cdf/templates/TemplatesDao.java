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

package com.aws.cdf.templates;

import com.typesafe.config.Config;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;

import javax.inject.Inject;
import java.util.Map;

import static com.aws.cdf.persistence.DynamoDbUtils.*;

@Slf4j
public class TemplatesDao {

    private final DynamoDbAsyncClient ddb;
    private final String tableName;

    @Inject
    public TemplatesDao(DynamoDbAsyncClient ddb, Config config) {
        this.ddb = ddb;
        this.tableName = config.getString("provisioning.aws.dynamodb.table");
    }

    /**
     * @return the template version, or null if not found
     */
    public TemplateItem get(String name, int versionNo) {
        log.debug("get> in> name:{}, versionNo:{}", name, versionNo);

        var request = GetItemRequest.builder()
                .tableName(tableName)
                .key(Map.of(
                        "pk", s("template:" + name),
                        "sk", s("version:" + versionNo)))
                .build();
        log.trace("get> request:{}", request);

        var response = join(ddb.getItem(request), String.format("getting template %s v%s", name, versionNo));
        if (!response.hasItem()) {
            log.debug("get> exit: not found");
            return null;
        }

        var item = response.item();
        var storedVersionNo = getInteger(item, "versionNo");
        var result = TemplateItem.builder()
                .name(getString(item, "name"))
                .versionNo(storedVersionNo != null ? storedVersionNo : versionNo)
                .groupId(getString(item, "groupId"))
                .groupVersionId(getString(item, "groupVersionId"))
                .enabled(getBoolean(item, "enabled"))
                .createdAt(getDateTime(item, "createdAt"))
                .updatedAt(getDateTime(item, "updatedAt"))
                .build();

        log.debug("get> exit:{}", result);
        return result;
    }
}
