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
import com.aws.cdf.devices.TaskStatus;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public abstract class AbstractDeviceAssociationHandler implements DeviceAssociationHandler {

	protected void failDevice(DeviceItem device, String message) {
		log.warn("failDevice> {}: thingName:{}, message:{}", name(), device.getThingName(), message);
		device.setStatus(TaskStatus.FAILURE);
		device.setStatusMessage(message);
	}

	protected HandlerResult failTask(AssociationRequest request, String message) {
		log.warn("failTask> {}: taskId:{}, message:{}", name(), request.getTaskInfo().getTaskId(), message);
		request.failTask(message);
		return HandlerResult.HALT;
	}
}
