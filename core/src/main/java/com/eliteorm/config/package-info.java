/** Connection settings read from the environment. */
package com.eliteorm.config;
