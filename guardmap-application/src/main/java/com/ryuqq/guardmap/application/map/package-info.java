/**
 * GuardedMap 파사드 패키지.
 *
 * <p>{@link com.ryuqq.guardmap.application.map.GuardedMap}은 SPI 컨테이너를 감싸고
 * 메모리 예산, 락 정책, 재시도 전송을 하나의 API로 결합합니다.</p>
 *
 * <p><strong>조립:</strong></p>
 * <ul>
 *   <li>컨테이너: {@link com.ryuqq.guardmap.core.spi.OrderedContainer} 구현 (필수)</li>
 *   <li>설정: {@link com.ryuqq.guardmap.application.config.GuardedMapConfig}</li>
 *   <li>크기 계측: {@link com.ryuqq.guardmap.core.spi.EntrySizer} 또는 codec 인코딩 길이</li>
 * </ul>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
package com.ryuqq.guardmap.application.map;
