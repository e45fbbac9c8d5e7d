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

import com.aws.cdf.DateTimeAdapter;
import com.aws.cdf.devices.DeviceTaskSqsWriter;
import com.aws.cdf.devices.DevicesDao;
import com.aws.cdf.devices.DevicesService;
import com.aws.cdf.devices.DevicesServiceImpl;
import com.aws.cdf.devices.LookupThreadFactory;
import com.aws.cdf.devices.handlers.CoreConfigHandler;
import com.aws.cdf.devices.handlers.CreateGroupVersionHandler;
import com.aws.cdf.devices.handlers.DeviceAssociationChain;
import com.aws.cdf.devices.handlers.ExistingAssociationHandler;
import com.aws.cdf.devices.handlers.GetPrincipalHandler;
import com.aws.cdf.devices.handlers.GetThingHandler;
import com.aws.cdf.devices.handlers.ProvisionThingHandler;
import com.aws.cdf.devices.handlers.SaveGroupHandler;
import com.aws.cdf.greengrass.GreengrassUtils;
import com.aws.cdf.groups.GroupsDao;
import com.aws.cdf.templates.TemplatesDao;
import com.aws.cdf.things.IotUtils;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import dagger.Module;
import dagger.Provides;
import org.joda.time.DateTime;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.greengrass.GreengrassAsyncClient;
import software.amazon.awssdk.services.iot.IotAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import javax.inject.Singleton;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

@Module
public class ProvisioningModule {

	@Provides
	@Singleton
	public Config provideConfig() {
		var config = ConfigFactory.load();
		config.checkValid(ConfigFactory.defaultReference(), "provisioning");

		return config;
	}

	@Provides
	@Singleton
	public ClientOverrideConfiguration provideClientOverrideConfiguration(Config config) {
		return ClientOverrideConfiguration.builder()
			.apiCallTimeout(Duration.ofMillis(config.getLong("provisioning.aws.apiCallTimeoutInMillis")))
			.build();
	}

	@Provides
	@Singleton
	public DynamoDbAsyncClient provideDynamoDbClient(Config config, ClientOverrideConfiguration overrides) {
		return DynamoDbAsyncClient.builder()
			.region(Region.of(config.getString("provisioning.aws.region")))
			.overrideConfiguration(overrides)
			.build();
	}

	@Provides
	@Singleton
	public SqsAsyncClient provideSqsClient(Config config, ClientOverrideConfiguration overrides) {
		return SqsAsyncClient.builder()
			.region(Region.of(config.getString("provisioning.aws.region")))
			.overrideConfiguration(overrides)
			.build();
	}

	@Provides
	@Singleton
	public GreengrassAsyncClient provideGreengrassClient(Config config, ClientOverrideConfiguration overrides) {
		return GreengrassAsyncClient.builder()
			.region(Region.of(config.getString("provisioning.aws.region")))
			.overrideConfiguration(overrides)
			.build();
	}

	@Provides
	@Singleton
	public IotAsyncClient provideIotClient(Config config, ClientOverrideConfiguration overrides) {
		return IotAsyncClient.builder()
			.region(Region.of(config.getString("provisioning.aws.region")))
			.overrideConfiguration(overrides)
			.build();
	}

	@Provides
	@Singleton
	public Gson provideGson() {
		return new GsonBuilder()
			.registerTypeAdapter(DateTime.class, new DateTimeAdapter())
			.create();
	}

	@Provides
	@Singleton
	public Executor provideLookupExecutor(Config config) {
		return Executors.newFixedThreadPool(config.getInt("provisioning.lookups.threads"), new LookupThreadFactory());
	}

	@Provides
	public DevicesDao provideDevicesDao(DynamoDbAsyncClient ddb, Config config) {
		return new DevicesDao(ddb, config);
	}

	@Provides
	public GroupsDao provideGroupsDao(DynamoDbAsyncClient ddb, Config config) {
		return new GroupsDao(ddb, config);
	}

	@Provides
	public TemplatesDao provideTemplatesDao(DynamoDbAsyncClient ddb, Config config) {
		return new TemplatesDao(ddb, config);
	}

	@Provides
	@Singleton
	public GreengrassUtils provideGreengrassUtils(GreengrassAsyncClient greengrass) {
		return new GreengrassUtils(greengrass);
	}

	@Provides
	@Singleton
	public IotUtils provideIotUtils(IotAsyncClient iot) {
		return new IotUtils(iot);
	}

	@Provides
	public DeviceTaskSqsWriter provideDeviceTaskSqsWriter(SqsAsyncClient sqsClient, Config config, Gson gson) {
		return new DeviceTaskSqsWriter(sqsClient, config, gson);
	}

	/**
	 * The order of the steps is significant: things must exist before their principals are read, and the group
	 * version may only be created once every device has been checked.
	 */
	@Provides
	public DeviceAssociationChain provideDeviceAssociationChain(IotUtils iotUtils, GreengrassUtils greengrassUtils,
																DevicesDao devicesDao, GroupsDao groupsDao) {
		return new DeviceAssociationChain(List.of(
			new GetThingHandler(iotUtils, GetThingHandler.Pass.BEFORE_PROVISIONING),
			new ExistingAssociationHandler(devicesDao),
			new ProvisionThingHandler(iotUtils),
			new GetThingHandler(iotUtils, GetThingHandler.Pass.AFTER_PROVISIONING),
			new CoreConfigHandler(),
			new GetPrincipalHandler(iotUtils),
			new CreateGroupVersionHandler(greengrassUtils)),
			new SaveGroupHandler(devicesDao, groupsDao));
	}

	@Provides
	public DevicesService provideDevicesService(DevicesDao devicesDao, GroupsDao groupsDao, TemplatesDao templatesDao,
												GreengrassUtils greengrassUtils, DeviceTaskSqsWriter sqsWriter,
												DeviceAssociationChain chain, Executor lookupExecutor) {
		return new DevicesServiceImpl(devicesDao, groupsDao, templatesDao, greengrassUtils, sqsWriter, chain, lookupExecutor);
	}
}
