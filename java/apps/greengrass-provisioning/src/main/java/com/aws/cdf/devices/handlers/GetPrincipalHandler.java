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
 * Resolves the certificate attached to each thing, which Greengrass requires for every core and device.
 */
@Slf4j
public class GetPrincipalHandler extends AbstractDeviceAssociationHandler {

	private static final String CERTIFICATE_ARN_MARKER = ":cert/";

	private final IotUtils iotUtils;

	public GetPrincipalHandler(IotUtils iotUtils) {
		this.iotUtils = iotUtils;
	}

	@Override
	public HandlerResult handle(AssociationRequest request) {
		log.debug("handle> in> taskId:{}", request.getTaskInfo().getTaskId());

		for (var device : request.activeDevices()) {
			var thingName = device.getThingName();
			var certificateArn = iotUtils.listThingPrincipals(thingName).stream()
				.filter(p -> p.contains(CERTIFICATE_ARN_MARKER))
				.findFirst();
			if (certificateArn.isPresent()) {
				request.getCertificateArns().put(thingName, certificateArn.get());
			} else {
				failDevice(device, String.format("No certificate attached to thing '%s'.", thingName));
			}
		}

		log.debug("handle> exit: certificateArns:{}", request.getCertificateArns());
		return HandlerResult.CONTINUE;
	}
}
