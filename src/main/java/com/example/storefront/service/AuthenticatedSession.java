package com.example.storefront.service;

import com.example.storefront.adapter.riot.session.SessionContext;
import com.example.storefront.domain.entity.AttemptSpec;
import com.example.storefront.domain.entity.AuthTokens;
import com.example.storefront.domain.entity.AuthVariant;

/**
 * The winning attempt carried forward into the token pipeline: same session, same agent, same tokens.
 */
public record AuthenticatedSession(AttemptSpec attempt, AuthVariant variant, SessionContext session, AuthTokens tokens) {}
