/**
 * HTTP module and its typed options. Filters are accumulated in an explicit
 * ordered list on {@link com.sailfish.servicekit.http.HttpModuleConfig}.
 */
package com.sailfish.servicekit.http;
