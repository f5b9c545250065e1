package com.wpanther.greengoods.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite primary key (platform, platformId) shared by users and sessions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private Platform platform;

    private String platformId;
}
