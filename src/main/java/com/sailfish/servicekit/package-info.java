/**
 * Building blocks for services: a host and module lifecycle, an asynchronous task
 * module, typed HTTP module options and a logging façade.
 */
package com.sailfish.servicekit;
