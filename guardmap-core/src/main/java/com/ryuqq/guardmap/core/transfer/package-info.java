/**
 * 재시도, 타임아웃, 체크섬 프레이밍을 제공하는 전송 패키지.
 *
 * <p><strong>프레임 형식:</strong></p>
 * <pre>
 * [CRC-32 (4B, big-endian)][payload length (4B)][payload]
 * </pre>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.guardmap.core.transfer.ResilientChannel} - 타임아웃과 재시도를 적용한 송수신</li>
 *   <li>{@link com.ryuqq.guardmap.core.transfer.EnvelopeCodec} - 프레임 인코딩/디코딩</li>
 *   <li>{@link com.ryuqq.guardmap.core.transfer.TransferErrorClassifier} - 일시적/치명적 실패 분류</li>
 *   <li>{@link com.ryuqq.guardmap.core.transfer.RetryPolicy} - 시도 횟수와 백오프</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.guardmap.core.transfer;
