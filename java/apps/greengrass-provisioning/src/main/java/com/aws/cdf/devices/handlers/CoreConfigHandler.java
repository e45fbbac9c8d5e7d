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
import lombok.extern.slf4j.Slf4j;

import java.util.stream.Collectors;

/**
 * Validates the requested core configuration against the group's template: the template must be enabled, and
 * a group has exactly one core so at most one core may be requested.
 */
@Slf4j
public class CoreConfigHandler extends AbstractDeviceAssociationHandler {

	@Override
	public HandlerResult handle(AssociationRequest request) {
		log.debug("handle> in> taskId:{}", request.getTaskInfo().getTaskId());

		var template = request.getTemplate();
		if (!template.isEnabled()) {
			return failTask(request, String.format("Template '%s' version %s is disabled.", template.getName(), template.getVersionNo()));
		}

		for (var device : request.activeDevices()) {
			if (!DeviceItem.TYPE_CORE.equals(device.getType()) && !DeviceItem.TYPE_DEVICE.equals(device.getType())) {
				failDevice(device, String.format("Unsupported device type '%s'.", device.getType()));
			}
		}

		var cores = request.activeDevices().stream().filter(DeviceItem::isCore).collect(Collectors.toList());
		if (cores.size() > 1) {
			return failTask(request, String.format("Only 1 core may be associated with a group, but %d were requested.", cores.size()));
		}

		if (cores.size() == 1 && !request.getGgCoreVersion().getMembers().isEmpty()) {
			log.info("handle> core {} will replace the existing cores {}", cores.get(0).getThingName(),
				request.getGgCoreVersion().getMembers());
		}

		log.debug("handle> exit:");
		return HandlerResult.CONTINUE;
	}
}
