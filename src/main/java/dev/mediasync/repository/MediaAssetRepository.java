package dev.mediasync.repository;

import dev.mediasync.entity.MediaAsset;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MediaAssetRepository extends R2dbcRepository<MediaAsset, String> {
}
