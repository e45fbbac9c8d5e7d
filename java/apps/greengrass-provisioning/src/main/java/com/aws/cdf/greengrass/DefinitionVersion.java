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

package com.aws.cdf.greengrass;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DefinitionVersion {
	String arn;
	String definitionId;
	String versionId;
	List<DefinitionMember> members;

	/**
	 * Used when a group version does not reference a definition of the requested kind.
	 */
	public static DefinitionVersion empty() {
		return DefinitionVersion.builder().members(List.of()).build();
	}

	public boolean exists() {
		return definitionId != null;
	}
}
