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

import com.aws.cdf.things.IotUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the thing of each device. Runs twice: before provisioning, where a missing thing is simply left for
 * provisioning, and after provisioning, where a missing thing fails the device.
 */
@Slf4j
public class GetThingHandler extends AbstractDeviceAssociationHandler {

	public enum Pass {
		BEFORE_PROVISIONING,
		AFTER_PROVISIONING
	}

	private final IotUtils iotUtils;
	private final Pass pass;

	public GetThingHandler(IotUtils iotUtils, Pass pass) {
		this.iotUtils = iotUtils;
		this.pass = pass;
	}

	@Override
	public HandlerResult handle(AssociationRequest request) {
		log.debug("handle> in> pass:{}, taskId:{}", pass, request.getTaskInfo().getTaskId());

		for (var device : request.activeDevices()) {
			var thingName = device.getThingName();
			var thing = iotUtils.describeThing(thingName);
			if (thing.isPresent()) {
				request.getThings().put(thingName, thing.get());
			} else {
				request.getThings().remove(thingName);
				if (pass == Pass.AFTER_PROVISIONING) {
					failDevice(device, String.format("Thing '%s' not found.", thingName));
				}
			}
		}

		log.debug("handle> exit: things:{}", request.getThings().keySet());
		return HandlerResult.CONTINUE;
	}

	@Override
	public String name() {
		return String.format("GetThingHandler(%s)", pass);
	}
}
