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
import com.aws.cdf.greengrass.DefinitionVersion;
import com.aws.cdf.greengrass.GreengrassGroupVersion;
import com.aws.cdf.greengrass.GreengrassUtils;
import com.aws.cdf.groups.GroupsDao;
import com.aws.cdf.things.IotUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.DEVICE_DEFINITION_ID;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.GROUP_ID;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.GROUP_NAME;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.certificateArn;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.device;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.request;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.thing;
import static com.aws.cdf.devices.handlers.AssociationRequestFixtures.thingArn;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Runs the full chain of real steps against mocked control plane and stores.
 */
@ExtendWith(MockitoExtension.class)
public class DeviceAssociationFlowTest {

	@Mock
	private IotUtils iotUtils;
	@Mock
	private GreengrassUtils greengrassUtils;
	@Mock
	private DevicesDao devicesDao;
	@Mock
	private GroupsDao groupsDao;

	private DeviceAssociationChain underTest;

	@BeforeEach
	public void initEach() {
		underTest = new DeviceAssociationChain(List.of(
			new GetThingHandler(iotUtils, GetThingHandler.Pass.BEFORE_PROVISIONING),
			new ExistingAssociationHandler(devicesDao),
			new ProvisionThingHandler(iotUtils),
			new GetThingHandler(iotUtils, GetThingHandler.Pass.AFTER_PROVISIONING),
			new CoreConfigHandler(),
			new GetPrincipalHandler(iotUtils),
			new CreateGroupVersionHandler(greengrassUtils)),
			new SaveGroupHandler(devicesDao, groupsDao));
	}

	@Test
	public void conflictingDeviceFailsWhileSiblingIsAssociated() {
		var request = request(device("thing1"), device("thing2"));

		when(iotUtils.describeThing("thing1")).thenReturn(Optional.of(thing("thing1")));
		when(iotUtils.describeThing("thing2")).thenReturn(Optional.of(thing("thing2")));
		when(devicesDao.getDevice("thing1")).thenReturn(DeviceItem.builder()
			.thingName("thing1").groupName("group2").status(TaskStatus.SUCCESS).build());
		when(devicesDao.getDevice("thing2")).thenReturn(null);
		when(iotUtils.listThingPrincipals("thing2")).thenReturn(List.of(certificateArn("thing2")));
		when(greengrassUtils.createDeviceDefinitionVersion(eq(DEVICE_DEFINITION_ID), eq("group1-devices"), anyList()))
			.thenReturn(DefinitionVersion.builder().arn("arn:device:v2").definitionId(DEVICE_DEFINITION_ID).versionId("v2").members(List.of()).build());
		when(greengrassUtils.createGroupVersion(eq(GROUP_ID), any()))
			.thenReturn(GreengrassGroupVersion.builder().groupId(GROUP_ID).versionId("gv2").build());

		// test
		underTest.execute(request);

		// verify
		var taskInfo = request.getTaskInfo();
		assertEquals(TaskStatus.SUCCESS, taskInfo.getStatus());

		var thing1 = taskInfo.getDevices().get(0);
		assertEquals(TaskStatus.FAILURE, thing1.getStatus());
		assertEquals("Device already associated with group 'group2'.", thing1.getStatusMessage());

		var thing2 = taskInfo.getDevices().get(1);
		assertEquals(TaskStatus.SUCCESS, thing2.getStatus());
		assertEquals(thingArn("thing2"), thing2.getThingArn());
		assertEquals(certificateArn("thing2"), thing2.getCertificateArn());
		assertEquals(GROUP_NAME, thing2.getGroupName());

		assertEquals("gv2", request.getGroup().getVersionId());
		verify(iotUtils, never()).provisionThing(any(), any(), any());
		verify(iotUtils, never()).listThingPrincipals("thing1");
		verify(devicesDao).saveDeviceAssociationTask(taskInfo);
		verify(groupsDao).save(request.getGroup());
	}

	@Test
	public void taskFailsWhenNoDeviceRemains() {
		var request = request(device("thing1"));

		when(iotUtils.describeThing("thing1")).thenReturn(Optional.empty());
		when(devicesDao.getDevice("thing1")).thenReturn(null);
		when(iotUtils.provisionThing("thing1", "tmpl", null)).thenReturn(Map.of());

		// test
		underTest.execute(request);

		// verify
		var taskInfo = request.getTaskInfo();
		assertEquals(TaskStatus.FAILURE, taskInfo.getStatus());
		assertEquals("No devices remaining to associate.", taskInfo.getStatusMessage());
		assertEquals(TaskStatus.FAILURE, taskInfo.getDevices().get(0).getStatus());
		assertEquals("Thing 'thing1' not found.", taskInfo.getDevices().get(0).getStatusMessage());
		assertNull(request.getNewGroupVersion());
		verify(greengrassUtils, never()).createGroupVersion(any(), any());
		verify(devicesDao).saveDeviceAssociationTask(taskInfo);
		verify(groupsDao).save(request.getGroup());
	}
}
