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

package com.aws.cdf.di;

import com.aws.cdf.devices.DeviceTaskSummary;
import com.aws.cdf.devices.DevicesDao;
import com.aws.cdf.devices.TaskStatus;
import com.aws.cdf.greengrass.GreengrassUtils;
import com.aws.cdf.groups.GroupsDao;
import com.aws.cdf.things.IotUtils;
import com.typesafe.config.ConfigFactory;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.org.webcompere.systemstubs.environment.EnvironmentVariables;
import uk.org.webcompere.systemstubs.jupiter.SystemStub;
import uk.org.webcompere.systemstubs.jupiter.SystemStubsExtension;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(MockitoExtension.class)
@ExtendWith(SystemStubsExtension.class)
public class ProvisioningModuleTest {

	@SystemStub
	private EnvironmentVariables environmentVariables;
	@Mock
	private IotUtils iotUtils;
	@Mock
	private GreengrassUtils greengrassUtils;
	@Mock
	private DevicesDao devicesDao;
	@Mock
	private GroupsDao groupsDao;

	private final ProvisioningModule underTest = new ProvisioningModule();

	@BeforeEach
	public void initEach() {
		environmentVariables
			.set("AWS_REGION", "eu-west-1")
			.set("AWS_DYNAMODB_TABLE_NAME", "cdf-provisioning-test")
			.set("AWS_SQS_QUEUES_DEVICEASSOCIATIONS", "https://sqs.eu-west-1.amazonaws.com/123456789012/associations");
		ConfigFactory.invalidateCaches();
	}

	@AfterEach
	public void cleanup() {
		ConfigFactory.invalidateCaches();
	}

	@Test
	public void environmentOverridesReferenceConfig() {
		// test
		var actual = underTest.provideConfig();

		// verify
		assertEquals("eu-west-1", actual.getString("provisioning.aws.region"));
		assertEquals("cdf-provisioning-test", actual.getString("provisioning.aws.dynamodb.table"));
		assertEquals("https://sqs.eu-west-1.amazonaws.com/123456789012/associations",
			actual.getString("provisioning.aws.sqs.deviceAssociations.queueUrl"));
		assertEquals(5, actual.getInt("provisioning.aws.sqs.deviceAssociations.numberOfRetries"));
		assertEquals(4, actual.getInt("provisioning.lookups.threads"));
	}

	@Test
	public void chainStepsRunInFixedOrder() {
		// test
		var actual = underTest.provideDeviceAssociationChain(iotUtils, greengrassUtils, devicesDao, groupsDao);

		// verify
		var names = actual.getHandlers().stream().map(h -> h.name()).collect(Collectors.toList());
		assertEquals(List.of(
			"GetThingHandler(BEFORE_PROVISIONING)",
			"ExistingAssociationHandler",
			"ProvisionThingHandler",
			"GetThingHandler(AFTER_PROVISIONING)",
			"CoreConfigHandler",
			"GetPrincipalHandler",
			"CreateGroupVersionHandler"), names);
	}

	@Test
	public void gsonWritesTimestampsAsIso8601() {
		var gson = underTest.provideGson();
		var task = DeviceTaskSummary.builder()
			.taskId("task1")
			.status(TaskStatus.IN_PROGRESS)
			.createdAt(new DateTime(2023, 1, 1, 0, 0, DateTimeZone.UTC))
			.build();

		// test
		var json = gson.toJson(task);
		var actual = gson.fromJson(json, DeviceTaskSummary.class);

		// verify
		assertEquals("{\"taskId\":\"task1\",\"status\":\"InProgress\",\"createdAt\":\"2023-01-01T00:00:00.000Z\"}", json);
		assertEquals(task.getCreatedAt().getMillis(), actual.getCreatedAt().getMillis());
	}
}
