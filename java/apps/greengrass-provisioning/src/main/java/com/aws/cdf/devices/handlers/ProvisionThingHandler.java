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

import com.aws.cdf.exceptions.NotFoundException;
import com.aws.cdf.exceptions.UpstreamException;
import com.aws.cdf.things.IotUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Provisions the things that do not exist yet. A failure to provision fails that device only.
 */
@Slf4j
public class ProvisionThingHandler extends AbstractDeviceAssociationHandler {

	private final IotUtils iotUtils;

	public ProvisionThingHandler(IotUtils iotUtils) {
		this.iotUtils = iotUtils;
	}

	@Override
	public HandlerResult handle(AssociationRequest request) {
		log.debug("handle> in> taskId:{}", request.getTaskInfo().getTaskId());

		for (var device : request.activeDevices()) {
			var thingName = device.getThingName();
			if (request.getThings().containsKey(thingName)) {
				continue;
			}
			try {
				var resources = iotUtils.provisionThing(thingName, device.getProvisioningTemplate(), device.getProvisioningParameters());
				log.info("handle> provisioned thing {}: {}", thingName, resources);
			} catch (NotFoundException | UpstreamException e) {
				failDevice(device, String.format("Failed provisioning thing '%s': %s", thingName, e.getMessage()));
			}
		}

		log.debug("handle> exit:");
		return HandlerResult.CONTINUE;
	}
}
