package com.radiochat.storage;

/**
 * 오디오/아바타 바이너리를 저장하고 공개 URL을 돌려주는 외부 저장소.
 */
public interface BlobStore {

    /**
     * 바이트를 지정 경로에 저장한다.
     *
     * @param path        슬래시로 구분된 상대 경로 (예: audio/general/u1/1700000000000_uuid.m4a)
     * @param content     저장할 내용
     * @param contentType MIME 타입
     * @return 공개적으로 조회 가능한 URL
     * @throws com.radiochat.service.PersistenceException 저장에 실패한 경우
     */
    String store(String path, byte[] content, String contentType);
}
