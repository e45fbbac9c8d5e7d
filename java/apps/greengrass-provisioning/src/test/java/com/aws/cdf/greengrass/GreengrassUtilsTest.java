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

import com.aws.cdf.exceptions.NotFoundException;
import com.aws.cdf.exceptions.UpstreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.greengrass.GreengrassAsyncClient;
import software.amazon.awssdk.services.greengrass.model.CreateDeviceDefinitionRequest;
import software.amazon.awssdk.services.greengrass.model.CreateDeviceDefinitionResponse;
import software.amazon.awssdk.services.greengrass.model.CreateGroupVersionRequest;
import software.amazon.awssdk.services.greengrass.model.CreateGroupVersionResponse;
import software.amazon.awssdk.services.greengrass.model.Device;
import software.amazon.awssdk.services.greengrass.model.DeviceDefinitionVersion;
import software.amazon.awssdk.services.greengrass.model.GetDeviceDefinitionVersionRequest;
import software.amazon.awssdk.services.greengrass.model.GetDeviceDefinitionVersionResponse;
import software.amazon.awssdk.services.greengrass.model.GetGroupRequest;
import software.amazon.awssdk.services.greengrass.model.GreengrassException;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class GreengrassUtilsTest {

	private static final String DEVICE_VERSION_ARN =
		"arn:aws:greengrass:us-west-2:123456789012:/greengrass/definition/devices/def1/versions/ver1";

	@Mock
	private GreengrassAsyncClient greengrass;
	@Captor
	private ArgumentCaptor<GetDeviceDefinitionVersionRequest> deviceVersionRequestCaptor;
	@Captor
	private ArgumentCaptor<CreateDeviceDefinitionRequest> createDeviceDefinitionCaptor;
	@Captor
	private ArgumentCaptor<CreateGroupVersionRequest> createGroupVersionCaptor;

	private GreengrassUtils underTest;

	@BeforeEach
	public void initEach() {
		underTest = new GreengrassUtils(greengrass);
	}

	@Test
	public void missingDefinitionIsEmpty() {
		// test
		var actual = underTest.getDeviceInfo(null);

		// verify
		assertFalse(actual.exists());
		assertTrue(actual.getMembers().isEmpty());
		verifyNoInteractions(greengrass);
	}

	@Test
	public void readsDeviceMembers() {
		when(greengrass.getDeviceDefinitionVersion(deviceVersionRequestCaptor.capture()))
			.thenReturn(CompletableFuture.completedFuture(GetDeviceDefinitionVersionResponse.builder()
				.arn(DEVICE_VERSION_ARN)
				.id("def1")
				.version("ver1")
				.definition(DeviceDefinitionVersion.builder()
					.devices(Device.builder().id("thing1").thingArn("arn:thing/thing1").certificateArn("arn:cert/1").syncShadow(true).build())
					.build())
				.build()));

		// test
		var actual = underTest.getDeviceInfo(DEVICE_VERSION_ARN);

		// verify
		assertEquals("def1", deviceVersionRequestCaptor.getValue().deviceDefinitionId());
		assertEquals("ver1", deviceVersionRequestCaptor.getValue().deviceDefinitionVersionId());
		assertEquals("def1", actual.getDefinitionId());
		assertEquals(1, actual.getMembers().size());
		assertEquals("arn:thing/thing1", actual.getMembers().get(0).getThingArn());
		assertEquals(true, actual.getMembers().get(0).getSyncShadow());
	}

	@Test
	public void createsDeviceDefinitionWhenGroupHasNone() {
		when(greengrass.createDeviceDefinition(createDeviceDefinitionCaptor.capture()))
			.thenReturn(CompletableFuture.completedFuture(CreateDeviceDefinitionResponse.builder()
				.id("def2")
				.latestVersion("ver2")
				.latestVersionArn("arn:device:ver2")
				.build()));
		var members = List.of(DefinitionMember.builder().id("thing1").thingArn("arn:thing/thing1").certificateArn("arn:cert/1").syncShadow(false).build());

		// test
		var actual = underTest.createDeviceDefinitionVersion(null, "group1-devices", members);

		// verify
		assertEquals("group1-devices", createDeviceDefinitionCaptor.getValue().name());
		assertEquals(1, createDeviceDefinitionCaptor.getValue().initialVersion().devices().size());
		assertEquals("arn:device:ver2", actual.getArn());
		assertEquals("def2", actual.getDefinitionId());
	}

	@Test
	public void newGroupVersionCarriesAllDefinitions() {
		when(greengrass.createGroupVersion(createGroupVersionCaptor.capture()))
			.thenReturn(CompletableFuture.completedFuture(CreateGroupVersionResponse.builder()
				.id("group1")
				.version("gv2")
				.arn("arn:group1:gv2")
				.build()));
		var version = GreengrassGroupVersion.builder()
			.coreDefinitionVersionArn("arn:core")
			.deviceDefinitionVersionArn("arn:device")
			.functionDefinitionVersionArn("arn:function")
			.subscriptionDefinitionVersionArn("arn:subscription")
			.build();

		// test
		var actual = underTest.createGroupVersion("group1", version);

		// verify
		var request = createGroupVersionCaptor.getValue();
		assertEquals("arn:core", request.coreDefinitionVersionArn());
		assertEquals("arn:function", request.functionDefinitionVersionArn());
		assertEquals("arn:subscription", request.subscriptionDefinitionVersionArn());
		assertEquals("gv2", actual.getVersionId());
		assertEquals("arn:device", actual.getDeviceDefinitionVersionArn());
	}

	@Test
	public void missingGroupIsNotFound() {
		when(greengrass.getGroup(any(GetGroupRequest.class))).thenReturn(CompletableFuture.failedFuture(
			GreengrassException.builder().statusCode(404).message("not found").build()));

		// test
		assertThrows(NotFoundException.class, () -> underTest.getGroupInfo("group1"));
	}

	@Test
	public void otherServiceErrorsAreUpstream() {
		when(greengrass.getGroup(any(GetGroupRequest.class))).thenReturn(CompletableFuture.failedFuture(
			GreengrassException.builder().statusCode(500).message("internal").build()));

		// test
		var actual = assertThrows(UpstreamException.class, () -> underTest.getGroupInfo("group1"));

		// verify
		assertEquals(500, actual.getStatusCode());
	}
}
