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

package com.aws.cdf.groups;

import com.aws.cdf.devices.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.joda.time.DateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupItem {
	private String id;
	private String name;
	private String versionId;
	private Integer versionNo;
	private String templateName;
	private Integer templateVersionNo;

	/**
	 * outcome of the most recent device association task run against the group
	 */
	private TaskStatus taskStatus;
	private String statusMessage;

	private DateTime createdAt;
	private DateTime updatedAt;
}
