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

import com.aws.cdf.devices.DeviceItem;
import com.aws.cdf.devices.DevicesDao;
import com.aws.cdf.devices.TaskStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.GROUP_NAME;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.device;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ExistingAssociationHandlerTest {

	@Mock
	private DevicesDao devicesDao;

	@Test
	public void failsOnlyDevicesAssociatedWithAnotherGroup() {
		var request = request(device("new"), device("same"), device("other"), device("failedElsewhere"));
		when(devicesDao.getDevice("new")).thenReturn(null);
		when(devicesDao.getDevice("same")).thenReturn(DeviceItem.builder()
			.thingName("same").groupName(GROUP_NAME).status(TaskStatus.SUCCESS).build());
		when(devicesDao.getDevice("other")).thenReturn(DeviceItem.builder()
			.thingName("other").groupName("group2").status(TaskStatus.SUCCESS).build());
		when(devicesDao.getDevice("failedElsewhere")).thenReturn(DeviceItem.builder()
			.thingName("failedElsewhere").groupName("group3").status(TaskStatus.FAILURE).build());

		// test
		var actual = new ExistingAssociationHandler(devicesDao).handle(request);

		// verify
		assertEquals(HandlerResult.CONTINUE, actual);
		var devices = request.getTaskInfo().getDevices();
		assertEquals(TaskStatus.IN_PROGRESS, devices.get(0).getStatus());
		assertEquals(TaskStatus.IN_PROGRESS, devices.get(1).getStatus());
		assertEquals(TaskStatus.FAILURE, devices.get(2).getStatus());
		assertEquals("Device already associated with group 'group2'.", devices.get(2).getStatusMessage());
		assertEquals(TaskStatus.IN_PROGRESS, devices.get(3).getStatus());
		assertFalse(request.isTaskFailed());
	}
}
