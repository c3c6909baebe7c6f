/**
 * Service host and module lifecycle contracts.
 */
package com.sailfish.servicekit.service;
