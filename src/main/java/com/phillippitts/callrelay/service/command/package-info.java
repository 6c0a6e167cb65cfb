/**
 * Operator commands sent to devices, addressed through a call or by connection id.
 */
package com.phillippitts.callrelay.service.command;
