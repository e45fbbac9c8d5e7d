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

package com.aws.cdf.devices;

import com.typesafe.config.Config;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.aws.cdf.persistence.DynamoDbUtils.*;

/**
 * Stores device association tasks, and an association record per successfully associated device.
 */
@Slf4j
public class DevicesDao {

    static final String DEVICE_TASK_PREFIX = "deviceTask:";
    static final String GROUP_PREFIX = "group:";
    static final String DEVICE_PREFIX = "device:";

    private final DynamoDbAsyncClient ddb;
    private final String tableName;

    @Inject
    public DevicesDao(DynamoDbAsyncClient ddb, Config config) {
        this.ddb = ddb;
        this.tableName = config.getString("provisioning.aws.dynamodb.table");
    }

    /**
     * Writes the task, followed by the association record of each device that has been successfully associated.
     */
    public void saveDeviceAssociationTask(DeviceTaskSummary task) {
        log.debug("saveDeviceAssociationTask> in> task:{}", task);

        var item = new HashMap<String, AttributeValue>();
        item.put("pk", s(DEVICE_TASK_PREFIX + task.getTaskId()));
        item.put("sk", s(GROUP_PREFIX + task.getGroupName()));
        putString(item, "taskId", task.getTaskId());
        putString(item, "groupName", task.getGroupName());
        putString(item, "status", task.getStatus() != null ? task.getStatus().getValue() : null);
        putString(item, "statusMessage", task.getStatusMessage());
        putDateTime(item, "createdAt", task.getCreatedAt());
        putDateTime(item, "updatedAt", task.getUpdatedAt());
        if (task.getDevices() != null) {
            var devices = task.getDevices().stream()
                    .map(d -> AttributeValue.builder().m(marshallDevice(d)).build())
                    .collect(Collectors.toList());
            item.put("devices", AttributeValue.builder().l(devices).build());
        }

        put(item, "saving task " + task.getTaskId());

        if (task.getDevices() != null) {
            for (var device : task.getDevices()) {
                if (device.getStatus() == TaskStatus.SUCCESS) {
                    var record = marshallDevice(device);
                    record.put("pk", s(DEVICE_PREFIX + device.getThingName()));
                    record.put("sk", s(DEVICE_PREFIX + device.getThingName()));
                    putString(record, "groupName", task.getGroupName());
                    putString(record, "taskId", task.getTaskId());
                    put(record, "saving device " + device.getThingName());
                }
            }
        }

        log.debug("saveDeviceAssociationTask> exit:");
    }

    /**
     * @return the task, or null if not found
     */
    public DeviceTaskSummary getDeviceAssociationTask(String groupName, String taskId) {
        log.debug("getDeviceAssociationTask> in> groupName:{}, taskId:{}", groupName, taskId);

        var item = get(DEVICE_TASK_PREFIX + taskId, GROUP_PREFIX + groupName, "getting task " + taskId);
        if (item == null) {
            log.debug("getDeviceAssociationTask> exit: not found");
            return null;
        }

        List<DeviceItem> devices = new ArrayList<>();
        var devicesAttr = item.get("devices");
        if (devicesAttr != null && devicesAttr.hasL()) {
            devices = devicesAttr.l().stream().map(a -> unmarshallDevice(a.m())).collect(Collectors.toList());
        }

        var result = DeviceTaskSummary.builder()
                .taskId(getString(item, "taskId"))
                .groupName(getString(item, "groupName"))
                .status(TaskStatus.fromValue(getString(item, "status")))
                .statusMessage(getString(item, "statusMessage"))
                .createdAt(getDateTime(item, "createdAt"))
                .updatedAt(getDateTime(item, "updatedAt"))
                .devices(devices)
                .build();

        log.debug("getDeviceAssociationTask> exit:{}", result);
        return result;
    }

    /**
     * @return the association record of the device, or null if the device has never been associated
     */
    public DeviceItem getDevice(String thingName) {
        log.debug("getDevice> in> thingName:{}", thingName);

        var item = get(DEVICE_PREFIX + thingName, DEVICE_PREFIX + thingName, "getting device " + thingName);
        var result = item != null ? unmarshallDevice(item) : null;

        log.debug("getDevice> exit:{}", result);
        return result;
    }

    private Map<String, AttributeValue> get(String pk, String sk, String operation) {
        var request = GetItemRequest.builder()
                .tableName(tableName)
                .key(Map.of("pk", s(pk), "sk", s(sk)))
                .build();
        log.trace("get> request:{}", request);

        var response = join(ddb.getItem(request), operation);
        return response.hasItem() ? response.item() : null;
    }

    private void put(Map<String, AttributeValue> item, String operation) {
        var request = PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build();
        log.trace("put> request:{}", request);

        join(ddb.putItem(request), operation);
    }

    private Map<String, AttributeValue> marshallDevice(DeviceItem device) {
        var m = new HashMap<String, AttributeValue>();
        putString(m, "thingName", device.getThingName());
        putString(m, "type", device.getType());
        putString(m, "provisioningTemplate", device.getProvisioningTemplate());
        putStringMap(m, "provisioningParameters", device.getProvisioningParameters());
        putBoolean(m, "syncShadow", device.getSyncShadow());
        putString(m, "status", device.getStatus() != null ? device.getStatus().getValue() : null);
        putString(m, "statusMessage", device.getStatusMessage());
        putString(m, "thingArn", device.getThingArn());
        putString(m, "certificateArn", device.getCertificateArn());
        putDateTime(m, "createdAt", device.getCreatedAt());
        putDateTime(m, "updatedAt", device.getUpdatedAt());
        return m;
    }

    private DeviceItem unmarshallDevice(Map<String, AttributeValue> m) {
        return DeviceItem.builder()
                .thingName(getString(m, "thingName"))
                .type(getString(m, "type"))
                .provisioningTemplate(getString(m, "provisioningTemplate"))
                .provisioningParameters(getStringMap(m, "provisioningParameters"))
                .syncShadow(getBoolean(m, "syncShadow"))
                .status(TaskStatus.fromValue(getString(m, "status")))
                .statusMessage(getString(m, "statusMessage"))
                .groupName(getString(m, "groupName"))
                .thingArn(getString(m, "thingArn"))
                .certificateArn(getString(m, "certificateArn"))
                .createdAt(getDateTime(m, "createdAt"))
                .updatedAt(getDateTime(m, "updatedAt"))
                .build();
    }
}
