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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DefinitionVersionArnTest {

	@Test
	public void parsesDefinitionAndVersionIds() {
		var actual = DefinitionVersionArn.parse(
			"arn:aws:greengrass:us-west-2:123456789012:/greengrass/definition/devices/4ad66e5d-a4c3/versions/8ba5d4ec-c9b7");

		assertEquals("4ad66e5d-a4c3", actual.getDefinitionId());
		assertEquals("8ba5d4ec-c9b7", actual.getVersionId());
	}

	@Test
	public void rejectsArnsThatAreNotDefinitionVersions() {
		assertThrows(IllegalArgumentException.class, () -> DefinitionVersionArn.parse(
			"arn:aws:greengrass:us-west-2:123456789012:/greengrass/groups/abc/versions/def"));
	}
}
