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

/**
 * A step of the device association chain. A step may fail individual devices and continue, or fail the whole
 * task via {@link AssociationRequest#failTask(String)} and return {@link HandlerResult#HALT}. Any exception
 * thrown is treated as a failure of the whole task.
 */
public interface DeviceAssociationHandler {

	HandlerResult handle(AssociationRequest request);

	default String name() {
		return getClass().getSimpleName();
	}
}
