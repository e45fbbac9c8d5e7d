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

import java.util.List;

public interface DevicesService {

	/**
	 * Validates the request, records a new task as {@code Waiting}, and queues it for asynchronous processing.
	 * Poll {@link #getDeviceAssociationTask(String, String)} for the outcome.
	 */
	DeviceTaskSummary createDeviceAssociationTask(String groupName, List<DeviceItem> items);

	/**
	 * Processes a queued task. The outcome is only observable through the persisted task.
	 */
	void associateDevicesWithGroup(DeviceTaskSummary taskInfo);

	DeviceTaskSummary getDeviceAssociationTask(String groupName, String taskId);

	DeviceItem getDevice(String deviceId);
}
