/**
 * 전송 실패와 지연을 재현하는 테스트용 Sink 및 Sleeper.
 *
 * @since 1.0.0
 */
package com.ryuqq.guardmap.testkit.transfer;
