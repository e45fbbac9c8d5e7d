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

package com.aws.cdf.devices.handlers;

import com.aws.cdf.devices.DeviceItem;
import com.aws.cdf.devices.DeviceTaskSummary;
import com.aws.cdf.devices.TaskStatus;
import com.aws.cdf.greengrass.DefinitionVersion;
import com.aws.cdf.greengrass.GreengrassGroup;
import com.aws.cdf.greengrass.GreengrassGroupVersion;
import com.aws.cdf.groups.GroupItem;
import com.aws.cdf.templates.TemplateItem;
import com.aws.cdf.things.ThingInfo;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The context threaded through the device association chain. Owned by a single chain execution.
 */
@Slf4j
@Data
@Builder
public class AssociationRequest {

	private DeviceTaskSummary taskInfo;
	private GroupItem group;
	private GreengrassGroup ggGroup;
	private GreengrassGroupVersion ggGroupVersion;
	private DefinitionVersion ggCoreVersion;
	private DefinitionVersion ggDeviceVersion;
	private TemplateItem template;

	/**
	 * things known to exist, keyed by thing name
	 */
	@Builder.Default
	private Map<String, ThingInfo> things = new LinkedHashMap<>();

	/**
	 * certificate principal attached to each thing, keyed by thing name
	 */
	@Builder.Default
	private Map<String, String> certificateArns = new LinkedHashMap<>();

	private GreengrassGroupVersion newGroupVersion;

	/**
	 * Records the failure of the whole task. The first failure recorded wins.
	 *
	 * @return false if a failure had already been recorded
	 */
	public boolean failTask(String message) {
		if (isTaskFailed()) {
			log.debug("failTask> keeping first failure '{}', ignoring '{}'", group.getStatusMessage(), message);
			return false;
		}
		group.setTaskStatus(TaskStatus.FAILURE);
		group.setStatusMessage(message);
		return true;
	}

	public boolean isTaskFailed() {
		return group.getTaskStatus() == TaskStatus.FAILURE;
	}

	/**
	 * @return the devices of the task that have not been failed
	 */
	public List<DeviceItem> activeDevices() {
		return taskInfo.getDevices().stream()
			.filter(d -> !d.isFailed())
			.collect(Collectors.toList());
	}
}
