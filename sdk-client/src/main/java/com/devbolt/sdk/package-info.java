/**
 * Application SDK: a file-backed {@link com.devbolt.sdk.DevBoltClient} with
 * hot reload and fallbacks, a static {@link com.devbolt.sdk.DevBolt} facade,
 * and JSON audit output for evaluations.
 */
package com.devbolt.sdk;
