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

import com.google.gson.annotations.SerializedName;

/**
 * Status shared by a device association task, the devices within it, and the outcome recorded on a group.
 */
public enum TaskStatus {
	@SerializedName("Waiting")
	WAITING("Waiting"),
	@SerializedName("InProgress")
	IN_PROGRESS("InProgress"),
	@SerializedName("Success")
	SUCCESS("Success"),
	@SerializedName("Failure")
	FAILURE("Failure");

	private final String value;

	TaskStatus(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public boolean isTerminal() {
		return this == SUCCESS || this == FAILURE;
	}

	public static TaskStatus fromValue(String value) {
		if (value == null) {
			return null;
		}
		for (var status : values()) {
			if (status.value.equals(value)) {
				return status;
			}
		}
		throw new IllegalArgumentException(String.format("Unrecognized task status '%s'.", value));
	}

	@Override
	public String toString() {
		return value;
	}
}
