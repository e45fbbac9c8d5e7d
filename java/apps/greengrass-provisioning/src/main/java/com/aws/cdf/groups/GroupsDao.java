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

package com.aws.cdf.groups;

import com.aws.cdf.devices.TaskStatus;
import com.typesafe.config.Config;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import javax.inject.Inject;
import java.util.HashMap;
import java.util.Map;

import static com.aws.cdf.persistence.DynamoDbUtils.*;

@Slf4j
public class GroupsDao {

    static final String GROUP_PREFIX = "group:";

    private final DynamoDbAsyncClient ddb;
    private final String tableName;

    @Inject
    public GroupsDao(DynamoDbAsyncClient ddb, Config config) {
        this.ddb = ddb;
        this.tableName = config.getString("provisioning.aws.dynamodb.table");
    }

    /**
     * @return the group, or null if not found
     */
    public GroupItem get(String name) {
        log.debug("get> in> name:{}", name);

        var request = GetItemRequest.builder()
                .tableName(tableName)
                .key(Map.of(
                        "pk", s(GROUP_PREFIX + name),
                        "sk", s(GROUP_PREFIX + name)))
                .build();
        log.trace("get> request:{}", request);

        var response = join(ddb.getItem(request), "getting group " + name);
        if (!response.hasItem()) {
            log.debug("get> exit: not found");
            return null;
        }

        var item = response.item();
        var result = GroupItem.builder()
                .id(getString(item, "id"))
                .name(getString(item, "name"))
                .versionId(getString(item, "versionId"))
                .versionNo(getInteger(item, "versionNo"))
                .templateName(getString(item, "templateName"))
                .templateVersionNo(getInteger(item, "templateVersionNo"))
                .taskStatus(TaskStatus.fromValue(getString(item, "taskStatus")))
                .statusMessage(getString(item, "statusMessage"))
                .createdAt(getDateTime(item, "createdAt"))
                .updatedAt(getDateTime(item, "updatedAt"))
                .build();

        log.debug("get> exit:{}", result);
        return result;
    }

    public void save(GroupItem group) {
        log.debug("save> in> group:{}", group);

        var item = new HashMap<String, AttributeValue>();
        item.put("pk", s(GROUP_PREFIX + group.getName()));
        item.put("sk", s(GROUP_PREFIX + group.getName()));
        putString(item, "id", group.getId());
        putString(item, "name", group.getName());
        putString(item, "versionId", group.getVersionId());
        putNumber(item, "versionNo", group.getVersionNo());
        putString(item, "templateName", group.getTemplateName());
        putNumber(item, "templateVersionNo", group.getTemplateVersionNo());
        putString(item, "taskStatus", group.getTaskStatus() != null ? group.getTaskStatus().getValue() : null);
        putString(item, "statusMessage", group.getStatusMessage());
        putDateTime(item, "createdAt", group.getCreatedAt());
        putDateTime(item, "updatedAt", group.getUpdatedAt());

        var request = PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build();
        log.trace("save> request:{}", request);

        join(ddb.putItem(request), "saving group " + group.getName());

        log.debug("save> exit:");
    }
}
