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
import com.aws.cdf.groups.GroupsDao;
import lombok.extern.slf4j.Slf4j;
import org.joda.time.DateTime;

/**
 * The terminal step, and the only place the outcome of a task is persisted. Reached either at the end of the
 * chain, when a step halts it, or from the failure path of the service.
 */
@Slf4j
public class SaveGroupHandler implements DeviceAssociationHandler {

	private final DevicesDao devicesDao;
	private final GroupsDao groupsDao;

	public SaveGroupHandler(DevicesDao devicesDao, GroupsDao groupsDao) {
		this.devicesDao = devicesDao;
		this.groupsDao = groupsDao;
	}

	@Override
	public HandlerResult handle(AssociationRequest request) {
		log.debug("handle> in> taskId:{}", request.getTaskInfo().getTaskId());

		var group = request.getGroup();
		var taskInfo = request.getTaskInfo();
		var now = DateTime.now();

		if (!request.isTaskFailed()) {
			group.setTaskStatus(TaskStatus.SUCCESS);
			group.setStatusMessage(null);
		}

		for (var device : taskInfo.getDevices()) {
			if (device.getStatus() == null || !device.getStatus().isTerminal()) {
				device.setStatus(group.getTaskStatus());
				if (request.isTaskFailed()) {
					device.setStatusMessage(group.getStatusMessage());
				}
			}
			if (device.getStatus() == TaskStatus.SUCCESS) {
				var thing = request.getThings().get(device.getThingName());
				device.setThingArn(thing != null ? thing.getThingArn() : null);
				device.setCertificateArn(request.getCertificateArns().get(device.getThingName()));
				device.setGroupName(group.getName());
			}
			device.setUpdatedAt(now);
		}

		taskInfo.setStatus(group.getTaskStatus());
		taskInfo.setStatusMessage(group.getStatusMessage());
		taskInfo.setUpdatedAt(now);
		group.setUpdatedAt(now);

		devicesDao.saveDeviceAssociationTask(taskInfo);
		groupsDao.save(group);

		log.debug("handle> exit: status:{}", taskInfo.getStatus());
		// nothing follows the terminal step
		return HandlerResult.HALT;
	}
}
