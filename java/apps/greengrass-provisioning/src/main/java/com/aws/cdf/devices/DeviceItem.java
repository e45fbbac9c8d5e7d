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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.joda.time.DateTime;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeviceItem {

	public static final String TYPE_CORE = "core";
	public static final String TYPE_DEVICE = "device";

	private String thingName;

	/**
	 * either {@code core} or {@code device}
	 */
	private String type;

	/**
	 * name of the IoT provisioning template used if the thing does not exist yet
	 */
	private String provisioningTemplate;
	private Map<String, String> provisioningParameters;
	private Boolean syncShadow;

	private TaskStatus status;
	private String statusMessage;

	/**
	 * only populated on the association record persisted once the device has been
	 * successfully associated
	 */
	private String groupName;
	private String thingArn;
	private String certificateArn;
	private DateTime createdAt;
	private DateTime updatedAt;

	public boolean isFailed() {
		return status == TaskStatus.FAILURE;
	}

	public boolean isCore() {
		return TYPE_CORE.equals(type);
	}
}
