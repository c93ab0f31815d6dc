package com.myorg.evbus.contracts.core.bus;

public record ConsumerRegistration(String topic, String groupId) {}
