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

import lombok.Value;
import org.apache.commons.lang3.Validate;

/**
 * The definition id and version id encoded in a definition version arn, e.g.
 * {@code arn:aws:greengrass:us-west-2:123456789012:/greengrass/definition/cores/<definitionId>/versions/<versionId>}
 */
@Value
public class DefinitionVersionArn {
	String definitionId;
	String versionId;

	public static DefinitionVersionArn parse(String arn) {
		Validate.notEmpty(arn, "Definition version arn is required.");

		var parts = arn.split("/");
		Validate.isTrue(parts.length >= 5 && "definition".equals(parts[parts.length - 5]) && "versions".equals(parts[parts.length - 2]),
			"Malformed definition version arn: %s", arn);

		return new DefinitionVersionArn(parts[parts.length - 3], parts[parts.length - 1]);
	}
}
