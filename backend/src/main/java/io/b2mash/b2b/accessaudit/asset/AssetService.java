package io.b2mash.b2b.accessaudit.asset;

import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.exception.ResourceNotFoundException;
import io.b2mash.b2b.accessaudit.store.AuditedEntityStore;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AssetService {

  private static final Logger log = LoggerFactory.getLogger(AssetService.class);

  private final AssetRepository assetRepository;
  private final NodeRepository nodeRepository;
  private final AuditedEntityStore store;

  public AssetService(
      AssetRepository assetRepository, NodeRepository nodeRepository, AuditedEntityStore store) {
    this.assetRepository = assetRepository;
    this.nodeRepository = nodeRepository;
    this.store = store;
  }

  @Transactional
  public Host createHost(AuditContext context, String name, String address, String os) {
    var host = store.save(context, new Host(name, address, os, context.tenantId()));
    log.info("Created host {} at {}", name, address);
    return host;
  }

  @Transactional
  public Node createNode(AuditContext context, String key, String value) {
    return store.save(context, new Node(key, value, context.tenantId()));
  }

  @Transactional
  public Asset changeAddress(AuditContext context, UUID assetId, String address) {
    var asset = requireAsset(assetId);
    asset.changeAddress(address);
    return store.save(context, asset, Set.of("address"));
  }

  @Transactional
  public Asset addToNodes(AuditContext context, UUID assetId, Collection<UUID> nodeIds) {
    return store.addRelated(
        context, Asset.NODES, requireAsset(assetId), nodeRepository.findAllById(nodeIds));
  }

  @Transactional
  public Asset removeFromNodes(AuditContext context, UUID assetId, Collection<UUID> nodeIds) {
    return store.removeRelated(
        context, Asset.NODES, requireAsset(assetId), nodeRepository.findAllById(nodeIds));
  }

  @Transactional
  public void deleteAsset(AuditContext context, UUID assetId) {
    var asset = requireAsset(assetId);
    store.delete(context, asset);
    log.info("Deleted asset {}", asset.getName());
  }

  private Asset requireAsset(UUID assetId) {
    return assetRepository
        .findById(assetId)
        .orElseThrow(() -> new ResourceNotFoundException("Asset", assetId));
  }
}
