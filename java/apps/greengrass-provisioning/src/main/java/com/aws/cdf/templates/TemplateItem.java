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

package com.aws.cdf.templates;

import lombok.Builder;
import lombok.Value;
import org.joda.time.DateTime;

@Value
@Builder
public class TemplateItem {
	String name;
	int versionNo;

	/**
	 * the Greengrass group (and version) the template was captured from
	 */
	String groupId;
	String groupVersionId;

	Boolean enabled;
	DateTime createdAt;
	DateTime updatedAt;

	public boolean isEnabled() {
		return enabled == null || enabled;
	}
}
