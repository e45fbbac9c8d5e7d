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

import com.aws.cdf.devices.TaskStatus;
import com.aws.cdf.things.IotUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.device;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.request;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.thing;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class GetThingHandlerTest {

	@Mock
	private IotUtils iotUtils;

	@Test
	public void beforeProvisioningLeavesMissingThingsForProvisioning() {
		var request = request(device("existing"), device("missing"));
		when(iotUtils.describeThing("existing")).thenReturn(Optional.of(thing("existing")));
		when(iotUtils.describeThing("missing")).thenReturn(Optional.empty());

		// test
		var actual = new GetThingHandler(iotUtils, GetThingHandler.Pass.BEFORE_PROVISIONING).handle(request);

		// verify
		assertEquals(HandlerResult.CONTINUE, actual);
		assertTrue(request.getThings().containsKey("existing"));
		assertFalse(request.getThings().containsKey("missing"));
		assertEquals(TaskStatus.IN_PROGRESS, request.getTaskInfo().getDevices().get(1).getStatus());
		assertNull(request.getTaskInfo().getDevices().get(1).getStatusMessage());
	}

	@Test
	public void afterProvisioningFailsMissingThings() {
		var request = request(device("existing"), device("missing"));
		when(iotUtils.describeThing("existing")).thenReturn(Optional.of(thing("existing")));
		when(iotUtils.describeThing("missing")).thenReturn(Optional.empty());

		// test
		var actual = new GetThingHandler(iotUtils, GetThingHandler.Pass.AFTER_PROVISIONING).handle(request);

		// verify
		assertEquals(HandlerResult.CONTINUE, actual);
		var missing = request.getTaskInfo().getDevices().get(1);
		assertEquals(TaskStatus.FAILURE, missing.getStatus());
		assertEquals("Thing 'missing' not found.", missing.getStatusMessage());
		assertEquals(TaskStatus.IN_PROGRESS, request.getTaskInfo().getDevices().get(0).getStatus());
		assertFalse(request.isTaskFailed());
	}

	@Test
	public void nameIncludesPass() {
		assertEquals("GetThingHandler(AFTER_PROVISIONING)",
			new GetThingHandler(iotUtils, GetThingHandler.Pass.AFTER_PROVISIONING).name());
	}
}
