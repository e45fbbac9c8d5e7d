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

import com.aws.cdf.devices.handlers.AssociationRequest;
import com.aws.cdf.devices.handlers.DeviceAssociationChain;
import com.aws.cdf.exceptions.DeviceNotFoundException;
import com.aws.cdf.exceptions.GroupNotFoundException;
import com.aws.cdf.exceptions.TaskNotFoundException;
import com.aws.cdf.exceptions.TemplateNotFoundException;
import com.aws.cdf.exceptions.UpstreamException;
import com.aws.cdf.exceptions.ValidationException;
import com.aws.cdf.greengrass.GreengrassUtils;
import com.aws.cdf.groups.GroupItem;
import com.aws.cdf.groups.GroupsDao;
import com.aws.cdf.templates.TemplateItem;
import com.aws.cdf.templates.TemplatesDao;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import org.joda.time.DateTime;

import javax.inject.Inject;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

@Slf4j
public class DevicesServiceImpl implements DevicesService {

	private final DevicesDao devicesDao;
	private final GroupsDao groupsDao;
	private final TemplatesDao templatesDao;
	private final GreengrassUtils greengrassUtils;
	private final DeviceTaskSqsWriter sqsWriter;
	private final DeviceAssociationChain chain;
	private final Executor lookupExecutor;

	@Inject
	public DevicesServiceImpl(DevicesDao devicesDao, GroupsDao groupsDao, TemplatesDao templatesDao,
							  GreengrassUtils greengrassUtils, DeviceTaskSqsWriter sqsWriter,
							  DeviceAssociationChain chain, Executor lookupExecutor) {
		this.devicesDao = devicesDao;
		this.groupsDao = groupsDao;
		this.templatesDao = templatesDao;
		this.greengrassUtils = greengrassUtils;
		this.sqsWriter = sqsWriter;
		this.chain = chain;
		this.lookupExecutor = lookupExecutor;
	}

	@Override
	public DeviceTaskSummary createDeviceAssociationTask(String groupName, List<DeviceItem> items) {
		log.debug("createDeviceAssociationTask> in> groupName:{}, items:{}", groupName, items);

		validate(() -> {
			Validate.notEmpty(groupName, "groupName is required.");
			Validate.notEmpty(items, "At least 1 device is required.");
			for (var device : items) {
				Validate.notNull(device, "Devices cannot be null.");
				Validate.notEmpty(device.getThingName(), "Device thingName is required.");
				Validate.notEmpty(device.getType(), "Device type is required.");
				Validate.isTrue(DeviceItem.TYPE_CORE.equals(device.getType())
						|| DeviceItem.TYPE_DEVICE.equals(device.getType()),
					"Unsupported device type '%s'.", device.getType());
				Validate.notEmpty(device.getProvisioningTemplate(), "Device provisioningTemplate is required.");
			}
		});

		// ensure the group exists
		var group = getGroupItem(groupName);
		greengrassUtils.getGroupInfo(group.getId());

		var now = DateTime.now();
		var taskInfo = DeviceTaskSummary.builder()
			.taskId(UUID.randomUUID().toString())
			.groupName(groupName)
			.status(TaskStatus.WAITING)
			.createdAt(now)
			.updatedAt(now)
			.devices(items.stream()
				.map(d -> d.toBuilder().status(TaskStatus.WAITING).statusMessage(null).build())
				.collect(Collectors.toList()))
			.build();

		// must be durable before it is queued, so the consumer can always find it
		devicesDao.saveDeviceAssociationTask(taskInfo);
		sqsWriter.submitWithRetry(taskInfo);

		log.debug("createDeviceAssociationTask> exit:{}", taskInfo);
		return taskInfo;
	}

	@Override
	public void associateDevicesWithGroup(DeviceTaskSummary taskInfo) {
		log.debug("associateDevicesWithGroup> in> taskInfo:{}", taskInfo);

		validate(() -> {
			Validate.notNull(taskInfo, "Task is required.");
			Validate.notEmpty(taskInfo.getTaskId(), "taskId is required.");
			Validate.notEmpty(taskInfo.getGroupName(), "groupName is required.");
			Validate.notEmpty(taskInfo.getDevices(), "At least 1 device is required.");
		});

		GroupItem group;
		try {
			group = getGroupItem(taskInfo.getGroupName());
		} catch (RuntimeException e) {
			log.error("associateDevicesWithGroup> failed finding group for task " + taskInfo.getTaskId(), e);
			failBeforeChain(taskInfo, e.getMessage());
			return;
		}

		// the outcome of any previous task is not relevant to this one
		group.setTaskStatus(TaskStatus.IN_PROGRESS);
		group.setStatusMessage(null);

		AssociationRequest request;
		try {
			request = prepareRequest(taskInfo, group);
		} catch (RuntimeException e) {
			log.error("associateDevicesWithGroup> failed preparing task " + taskInfo.getTaskId(), e);
			var partial = AssociationRequest.builder()
				.taskInfo(taskInfo)
				.group(group)
				.build();
			partial.failTask(e.getMessage());
			chain.persist(partial);
			return;
		}

		taskInfo.setStatus(TaskStatus.IN_PROGRESS);
		taskInfo.getDevices().forEach(d -> d.setStatus(TaskStatus.IN_PROGRESS));

		try {
			chain.execute(request);
		} catch (RuntimeException e) {
			// something unexpected went wrong within the chain
			log.error("associateDevicesWithGroup> chain failed for task " + taskInfo.getTaskId(), e);
			request.failTask(e.getMessage());
			chain.persist(request);
		}

		log.debug("associateDevicesWithGroup> exit: status:{}", taskInfo.getStatus());
	}

	@Override
	public DeviceTaskSummary getDeviceAssociationTask(String groupName, String taskId) {
		log.debug("getDeviceAssociationTask> in> groupName:{}, taskId:{}", groupName, taskId);

		validate(() -> {
			Validate.notEmpty(groupName, "groupName is required.");
			Validate.notEmpty(taskId, "taskId is required.");
		});

		var taskInfo = devicesDao.getDeviceAssociationTask(groupName, taskId);
		if (taskInfo == null) {
			throw new TaskNotFoundException(groupName, taskId);
		}

		log.debug("getDeviceAssociationTask> exit:{}", taskInfo);
		return taskInfo;
	}

	@Override
	public DeviceItem getDevice(String deviceId) {
		log.debug("getDevice> in> deviceId:{}", deviceId);

		validate(() -> Validate.notEmpty(deviceId, "deviceId is required."));

		var device = devicesDao.getDevice(deviceId);
		if (device == null) {
			throw new DeviceNotFoundException(deviceId);
		}

		log.debug("getDevice> exit:{}", device);
		return device;
	}

	/**
	 * Resolves everything the chain needs. The template lookup runs alongside the Greengrass lookups, and the
	 * core and device definition lookups run alongside each other.
	 */
	private AssociationRequest prepareRequest(DeviceTaskSummary taskInfo, GroupItem group) {
		log.debug("prepareRequest> in> taskId:{}", taskInfo.getTaskId());

		var templateFuture = CompletableFuture.supplyAsync(
			() -> getTemplateItem(group.getTemplateName(), group.getTemplateVersionNo()), lookupExecutor);

		var ggGroup = greengrassUtils.getGroupInfo(group.getId());
		var ggGroupVersion = greengrassUtils.getGroupVersionInfo(ggGroup.getId(), ggGroup.getLatestVersion());
		var coreFuture = CompletableFuture.supplyAsync(
			() -> greengrassUtils.getCoreInfo(ggGroupVersion.getCoreDefinitionVersionArn()), lookupExecutor);
		var deviceFuture = CompletableFuture.supplyAsync(
			() -> greengrassUtils.getDeviceInfo(ggGroupVersion.getDeviceDefinitionVersionArn()), lookupExecutor);

		AssociationRequest request;
		try {
			request = AssociationRequest.builder()
				.taskInfo(taskInfo)
				.group(group)
				.ggGroup(ggGroup)
				.ggGroupVersion(ggGroupVersion)
				.ggCoreVersion(coreFuture.join())
				.ggDeviceVersion(deviceFuture.join())
				.template(templateFuture.join())
				.build();
		} catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw new UpstreamException(e.getMessage(), e);
		}

		log.debug("prepareRequest> exit:");
		return request;
	}

	/**
	 * The group could not be found, so there is no group to save. The task must still not be left waiting.
	 */
	private void failBeforeChain(DeviceTaskSummary taskInfo, String message) {
		log.debug("failBeforeChain> in> taskId:{}, message:{}", taskInfo.getTaskId(), message);

		var now = DateTime.now();
		taskInfo.setStatus(TaskStatus.FAILURE);
		taskInfo.setStatusMessage(message);
		taskInfo.setUpdatedAt(now);
		taskInfo.getDevices().forEach(d -> {
			d.setStatus(TaskStatus.FAILURE);
			d.setStatusMessage(message);
			d.setUpdatedAt(now);
		});
		devicesDao.saveDeviceAssociationTask(taskInfo);

		log.debug("failBeforeChain> exit:");
	}

	private GroupItem getGroupItem(String groupName) {
		log.debug("getGroupItem> in> groupName:{}", groupName);

		var group = groupsDao.get(groupName);
		if (group == null) {
			log.error("getGroupItem> group {} not found", groupName);
			throw new GroupNotFoundException(groupName);
		}

		log.debug("getGroupItem> exit:{}", group);
		return group;
	}

	private TemplateItem getTemplateItem(String name, Integer versionNo) {
		log.debug("getTemplateItem> in> name:{}, versionNo:{}", name, versionNo);

		if (name == null || versionNo == null) {
			throw new TemplateNotFoundException(name, versionNo);
		}
		var template = templatesDao.get(name, versionNo);
		if (template == null) {
			log.error("getTemplateItem> template {} v{} not found", name, versionNo);
			throw new TemplateNotFoundException(name, versionNo);
		}

		log.debug("getTemplateItem> exit:{}", template);
		return template;
	}

	private void validate(Runnable validation) {
		try {
			validation.run();
		} catch (NullPointerException | IllegalArgumentException e) {
			throw new ValidationException(e.getMessage(), e);
		}
	}
}
