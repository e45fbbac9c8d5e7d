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

import com.aws.cdf.devices.DevicesDao;
import com.aws.cdf.devices.TaskStatus;
import lombok.extern.slf4j.Slf4j;

/**
 * Fails any device that is already associated with a different group. Other devices are unaffected.
 */
@Slf4j
public class ExistingAssociationHandler extends AbstractDeviceAssociationHandler {

	private final DevicesDao devicesDao;

	public ExistingAssociationHandler(DevicesDao devicesDao) {
		this.devicesDao = devicesDao;
	}

	@Override
	public HandlerResult handle(AssociationRequest request) {
		log.debug("handle> in> taskId:{}", request.getTaskInfo().getTaskId());

		var groupName = request.getGroup().getName();
		for (var device : request.activeDevices()) {
			var existing = devicesDao.getDevice(device.getThingName());
			if (existing != null
				&& existing.getStatus() == TaskStatus.SUCCESS
				&& existing.getGroupName() != null
				&& !existing.getGroupName().equals(groupName)) {
				failDevice(device, String.format("Device already associated with group '%s'.", existing.getGroupName()));
			}
		}

		log.debug("handle> exit:");
		return HandlerResult.CONTINUE;
	}
}
