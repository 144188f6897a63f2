package com.ryuqq.cryptogateway.core.model;

/**
 * 키 객체.
 *
 * <p>키 재료는 백엔드에만 존재하며, 게이트웨이는 백엔드 키 식별자와 메타데이터만 보관합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class KeyObject implements ManagedObject {

    public static final int PERMISSION_ENCRYPT = 0x0001;
    public static final int PERMISSION_DECRYPT = 0x0002;
    public static final int PERMISSION_EXPORT = 0x0004;
    public static final int PERMISSION_READ = 0x0008;
    public static final int PERMISSION_WRITE = 0x0010;

    private final String keyId;
    private final AlgorithmId algorithm;
    private final KeySpec keySpec;
    private final int keySize;
    private final boolean persistent;
    private final boolean imported;
    private volatile int permissions;

    public KeyObject(String keyId, AlgorithmId algorithm, KeySpec keySpec, int keySize,
                     boolean exportable, boolean persistent) {
        this(keyId, algorithm, keySpec, keySize, exportable, persistent, false);
    }

    private KeyObject(String keyId, AlgorithmId algorithm, KeySpec keySpec, int keySize,
                      boolean exportable, boolean persistent, boolean imported) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId cannot be null or blank");
        }
        if (algorithm == null || !algorithm.isKey()) {
            throw new IllegalArgumentException("algorithm must be a key algorithm");
        }
        if (keySpec == null) {
            throw new IllegalArgumentException("keySpec cannot be null");
        }
        if (keySize <= 0) {
            throw new IllegalArgumentException("keySize must be positive");
        }
        this.keyId = keyId;
        this.algorithm = algorithm;
        this.keySpec = keySpec;
        this.keySize = keySize;
        this.persistent = persistent;
        this.imported = imported;
        int base = PERMISSION_ENCRYPT | PERMISSION_DECRYPT | PERMISSION_READ | PERMISSION_WRITE;
        this.permissions = exportable ? base | PERMISSION_EXPORT : base;
    }

    /**
     * 가져온 공개키 blob으로 만든 키.
     *
     * <p>개인키가 없으므로 서명에 사용할 수 없고, 핸들 폐기 시 백엔드에서도 삭제됩니다.</p>
     *
     * @param keyId 백엔드 키 식별자
     * @param algorithm 키 알고리즘
     * @param keySize 키 길이 (비트)
     * @return 가져온 키 객체
     */
    public static KeyObject imported(String keyId, AlgorithmId algorithm, int keySize) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm cannot be null");
        }
        return new KeyObject(keyId, algorithm, algorithm.defaultKeySpec(), keySize, true, false, true);
    }

    @Override
    public HandleKind kind() {
        return HandleKind.KEY;
    }

    public String keyId() {
        return keyId;
    }

    public AlgorithmId algorithm() {
        return algorithm;
    }

    public KeySpec keySpec() {
        return keySpec;
    }

    public int keySize() {
        return keySize;
    }

    /**
     * 컨테이너에 저장된 키인지 여부.
     *
     * <p>영속 키가 아닌 키(verify context에서 생성/가져온 키)는 핸들 폐기 시 백엔드에서도 삭제됩니다.</p>
     *
     * @return 영속 키이면 true
     */
    public boolean isPersistent() {
        return persistent;
    }

    public boolean isImported() {
        return imported;
    }

    public int permissions() {
        return permissions;
    }

    public boolean isExportable() {
        return (permissions & PERMISSION_EXPORT) != 0;
    }

    /**
     * 권한 변경.
     *
     * <p>EXPORT 권한은 새로 부여할 수 없습니다 (제거만 가능).</p>
     *
     * @param newPermissions 새 권한 비트
     * @return 적용되었으면 true, EXPORT를 새로 부여하려 한 경우 false
     */
    public boolean updatePermissions(int newPermissions) {
        boolean grantsExport = (newPermissions & PERMISSION_EXPORT) != 0 && !isExportable();
        if (grantsExport) {
            return false;
        }
        this.permissions = newPermissions;
        return true;
    }

    @Override
    public String toString() {
        return "KeyObject{keyId=" + keyId + ", algorithm=" + algorithm + ", keySpec=" + keySpec
            + ", keySize=" + keySize + ", imported=" + imported + '}';
    }
}
