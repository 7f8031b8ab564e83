package io.github.amadeusitgroup.chunkedtransfer;

public enum TransferDirection {
    UPLOAD,
    DOWNLOAD
}
