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

/**
 * An immutable snapshot of a Greengrass group: the definition versions it references.
 */
@Value
@Builder(toBuilder = true)
public class GreengrassGroupVersion {
	String groupId;
	String versionId;
	String arn;

	String coreDefinitionVersionArn;
	String deviceDefinitionVersionArn;
	String functionDefinitionVersionArn;
	String loggerDefinitionVersionArn;
	String resourceDefinitionVersionArn;
	String subscriptionDefinitionVersionArn;
	String connectorDefinitionVersionArn;
}
