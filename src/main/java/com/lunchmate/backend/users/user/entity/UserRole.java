package com.lunchmate.backend.users.user.entity;

public enum UserRole { COOK, CUSTOMER }
